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
public class ChainHeadResponse {

    @JsonProperty("head_hash")
    private String headHash;

    @JsonProperty("head_sequence")
    private Long headSequence;

    @JsonProperty("pending_anchor")
    private long pendingAnchor;
}
