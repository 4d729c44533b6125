package com.mediguard.ledger.integrity;

import com.mediguard.ledger.domain.Prediction;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The logical content a chain entry commits to
 */
@Value
@Builder
public class ChainPayload {

    String predictionId;
    String userId;
    Map<String, Object> inputFeatures;
    Map<String, Object> predictionResult;
    Instant timestamp;
    String previousHash;

    public static ChainPayload of(Prediction prediction, String previousHash) {
        return ChainPayload.builder()
                .predictionId(prediction.getId())
                .userId(prediction.getUserId())
                .inputFeatures(prediction.getInputFeatures())
                .predictionResult(prediction.getPredictionResult())
                .timestamp(prediction.getTimestamp())
                .previousHash(previousHash)
                .build();
    }

    /**
     * Document handed to the canonical encoder. Key order here is irrelevant.
     */
    public Map<String, Object> toDocument() {
        Map<String, Object> predictionData = new LinkedHashMap<>();
        predictionData.put("input_features", inputFeatures);
        predictionData.put("prediction_result", predictionResult);

        Map<String, Object> document = new LinkedHashMap<>();
        document.put("prediction_id", predictionId);
        document.put("user_id", userId);
        document.put("prediction_data", predictionData);
        document.put("timestamp", timestamp == null ? null : CanonicalEncoder.formatTimestamp(timestamp));
        document.put("previous_hash", previousHash);
        return document;
    }
}
