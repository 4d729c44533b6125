package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One verifier finding, pinned to the chain position where it was detected
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainDiscrepancy {

    @JsonProperty("sequence")
    private long sequence;

    @JsonProperty("prediction_id")
    private String predictionId;

    @JsonProperty("type")
    private DiscrepancyType type;

    @JsonProperty("expected")
    private String expected;

    @JsonProperty("actual")
    private String actual;

    public String describe() {
        switch (type) {
            case PREDICTION_NOT_FOUND:
                return String.format("Entry %d: Prediction %s not found", sequence, predictionId);
            case LINK_MISMATCH:
                return String.format("Entry %d: Previous hash mismatch. Expected %s, got %s", sequence, expected, actual);
            case HASH_MISMATCH:
                return String.format("Entry %d: Hash mismatch. Expected %s, got %s", sequence, expected, actual);
            default:
                throw new IllegalStateException("Unknown discrepancy type: " + type);
        }
    }
}
