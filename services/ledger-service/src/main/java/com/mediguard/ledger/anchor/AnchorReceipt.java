package com.mediguard.ledger.anchor;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

/**
 * Acknowledgement of a head hash committed to the anchor ledger
 */
@Value
@Builder
public class AnchorReceipt {
    String reference;
    Long position;
    String mode;
    Map<String, Object> raw;
}
