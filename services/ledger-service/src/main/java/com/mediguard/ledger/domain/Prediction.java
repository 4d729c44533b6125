package com.mediguard.ledger.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Map;

/**
 * A stored disease-risk prediction. Written once by the prediction pipeline;
 * the hash chain only ever reads it.
 */
@Entity
@Table(name = "predictions", indexes = {
        @Index(name = "idx_predictions_user_id", columnList = "user_id"),
        @Index(name = "idx_predictions_timestamp", columnList = "timestamp"),
        @Index(name = "idx_predictions_user_timestamp", columnList = "user_id, timestamp")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Prediction {

    @Id
    @Column(name = "id", nullable = false, updatable = false)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Column(name = "timestamp", nullable = false)
    private Instant timestamp;

    @Enumerated(EnumType.STRING)
    @Column(name = "source", nullable = false, length = 16)
    private PredictionSource source;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "input_features", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> inputFeatures;

    @Convert(converter = JsonMapConverter.class)
    @Column(name = "prediction_result", nullable = false, columnDefinition = "TEXT")
    private Map<String, Object> predictionResult;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @PrePersist
    protected void onCreate() {
        Instant now = Instant.now().truncatedTo(ChronoUnit.MICROS);
        if (createdAt == null) {
            createdAt = now;
        }
        if (timestamp == null) {
            timestamp = now;
        }
    }
}
