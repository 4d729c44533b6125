package com.mediguard.ledger.service;

import com.mediguard.ledger.BaseLedgerIntegrationTest;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.domain.PredictionSource;
import com.mediguard.ledger.dto.RecordPredictionRequest;
import jakarta.validation.ConstraintViolationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Prediction Recording Service Validation Tests")
class PredictionRecordingServiceIntegrationTest extends BaseLedgerIntegrationTest {

    @Autowired
    private PredictionRecordingService recordingService;

    @Test
    @DisplayName("Should record a valid request and chain it")
    void shouldRecordValidRequest() {
        ChainEntry entry = recordingService.recordPrediction(RecordPredictionRequest.builder()
                .predictionId("valid-1")
                .userId("u-1")
                .source(PredictionSource.MANUAL)
                .inputFeatures(Map.of("age", 52))
                .predictionResult(Map.of("predicted_disease", "Healthy"))
                .build());

        assertThat(entry.getSequence()).isZero();
        assertThat(predictionRepository.existsById("valid-1")).isTrue();
    }

    @Test
    @DisplayName("Should reject a request without feature or result maps before touching the store")
    void shouldRejectMissingMaps() {
        RecordPredictionRequest request = RecordPredictionRequest.builder()
                .predictionId("invalid-1")
                .userId("u-1")
                .source(PredictionSource.CSV)
                .build();

        assertThatThrownBy(() -> recordingService.recordPrediction(request))
                .isInstanceOf(ConstraintViolationException.class)
                .hasMessageContaining("inputFeatures")
                .hasMessageContaining("predictionResult");

        assertThat(predictionRepository.count()).isZero();
        assertThat(chainEntryRepository.count()).isZero();
    }

    @Test
    @DisplayName("Should reject a null request")
    void shouldRejectNullRequest() {
        assertThatThrownBy(() -> recordingService.recordPrediction(null))
                .isInstanceOf(ConstraintViolationException.class);
    }
}
