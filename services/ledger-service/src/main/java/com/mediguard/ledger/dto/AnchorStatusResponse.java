package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AnchorStatusResponse {

    @JsonProperty("mode")
    private String mode;

    @JsonProperty("scheduler_state")
    private String schedulerState;

    @JsonProperty("interval")
    private Duration interval;

    @JsonProperty("service_available")
    private boolean serviceAvailable;

    @JsonProperty("pending_entries")
    private long pendingEntries;

    @JsonProperty("last_cycle_outcome")
    private String lastCycleOutcome;

    @JsonProperty("last_cycle_at")
    private Instant lastCycleAt;

    @JsonProperty("last_anchor_reference")
    private String lastAnchorReference;

    @JsonProperty("last_error")
    private String lastError;
}
