package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Outcome of one anchor commit cycle
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnchorCycleResult {

    public enum Outcome {
        NO_PENDING,
        COMMITTED,
        FAILED
    }

    @JsonProperty("outcome")
    private Outcome outcome;

    @JsonProperty("head_hash")
    private String headHash;

    @JsonProperty("reference")
    private String reference;

    @JsonProperty("position")
    private Long position;

    @JsonProperty("anchored_entries")
    private long anchoredEntries;

    @JsonProperty("first_sequence")
    private Long firstSequence;

    @JsonProperty("last_sequence")
    private Long lastSequence;

    @JsonProperty("error")
    private String error;

    @JsonProperty("completed_at")
    private Instant completedAt;
}
