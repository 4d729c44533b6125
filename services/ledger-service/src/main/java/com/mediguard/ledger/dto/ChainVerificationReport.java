package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonFormat;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

/**
 * Result of replaying the hash chain from genesis
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainVerificationReport {

    @JsonProperty("valid")
    private boolean valid;

    @JsonProperty("total_entries")
    private int totalEntries;

    @JsonProperty("errors")
    private List<String> errors;

    @JsonProperty("discrepancies")
    private List<ChainDiscrepancy> discrepancies;

    @JsonProperty("head_hash")
    private String headHash;

    @JsonProperty("message")
    private String message;

    @JsonProperty("verified_at")
    @JsonFormat(shape = JsonFormat.Shape.STRING)
    private Instant verifiedAt;
}
