package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * Local and external view of a single anchor transaction
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnchorLookupResponse {

    @JsonProperty("reference")
    private String reference;

    @JsonProperty("anchor_position")
    private Long anchorPosition;

    @JsonProperty("entry_count")
    private int entryCount;

    @JsonProperty("first_sequence")
    private Long firstSequence;

    @JsonProperty("last_sequence")
    private Long lastSequence;

    @JsonProperty("last_hash")
    private String lastHash;

    @JsonProperty("found_on_ledger")
    private boolean foundOnLedger;

    @JsonProperty("ledger_position")
    private Long ledgerPosition;

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("raw_data")
    private Map<String, Object> rawData;
}
