package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChainRebuildReport {

    @JsonProperty("deleted_entries")
    private long deletedEntries;

    @JsonProperty("rebuilt_entries")
    private long rebuiltEntries;

    @JsonProperty("verification")
    private ChainVerificationReport verification;
}
