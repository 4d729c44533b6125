package com.mediguard.ledger.anchor;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class AnchorVerification {
    String reference;
    boolean found;
    Long position;
    String mode;
    Map<String, Object> rawData;

    public static AnchorVerification notFound(String reference, String mode) {
        return AnchorVerification.builder()
                .reference(reference)
                .found(false)
                .mode(mode)
                .rawData(Map.of())
                .build();
    }
}
