package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.domain.Prediction;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Chain entry joined with a summary of the prediction it commits to
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ChainEntryResponse {

    @JsonProperty("sequence")
    private Long sequence;

    @JsonProperty("prediction_id")
    private String predictionId;

    @JsonProperty("previous_hash")
    private String previousHash;

    @JsonProperty("current_hash")
    private String currentHash;

    @JsonProperty("entry_timestamp")
    private Instant entryTimestamp;

    @JsonProperty("anchor_reference")
    private String anchorReference;

    @JsonProperty("anchor_position")
    private Long anchorPosition;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("prediction")
    private PredictionSummary prediction;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class PredictionSummary {

        @JsonProperty("user_id")
        private String userId;

        @JsonProperty("source")
        private String source;

        @JsonProperty("timestamp")
        private Instant timestamp;

        @JsonProperty("predicted_disease")
        private Object predictedDisease;
    }

    public static ChainEntryResponse from(ChainEntry entry, Prediction prediction) {
        ChainEntryResponseBuilder builder = ChainEntryResponse.builder()
                .sequence(entry.getSequence())
                .predictionId(entry.getPredictionId())
                .previousHash(entry.getPreviousHash())
                .currentHash(entry.getCurrentHash())
                .entryTimestamp(entry.getEntryTimestamp())
                .anchorReference(entry.getAnchorReference())
                .anchorPosition(entry.getAnchorPosition())
                .createdAt(entry.getCreatedAt());
        if (prediction != null) {
            builder.prediction(PredictionSummary.builder()
                    .userId(prediction.getUserId())
                    .source(prediction.getSource() == null ? null : prediction.getSource().name().toLowerCase())
                    .timestamp(prediction.getTimestamp())
                    .predictedDisease(prediction.getPredictionResult() == null
                            ? null : prediction.getPredictionResult().get("predicted_disease"))
                    .build());
        }
        return builder.build();
    }
}
