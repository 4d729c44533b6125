package com.mediguard.ledger.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.mediguard.ledger.domain.PredictionSource;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.Map;

/**
 * A freshly produced prediction to store and chain. The id is generated when absent.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RecordPredictionRequest {

    @JsonProperty("prediction_id")
    private String predictionId;

    @NotBlank
    @JsonProperty("user_id")
    private String userId;

    @NotNull
    @JsonProperty("source")
    private PredictionSource source;

    @NotEmpty
    @JsonProperty("input_features")
    private Map<String, Object> inputFeatures;

    @NotEmpty
    @JsonProperty("prediction_result")
    private Map<String, Object> predictionResult;

    @JsonProperty("timestamp")
    private Instant timestamp;
}
