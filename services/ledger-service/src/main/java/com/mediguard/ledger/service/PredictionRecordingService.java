package com.mediguard.ledger.service;

import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.dto.RecordPredictionRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import org.springframework.validation.annotation.Validated;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.LinkedHashMap;
import java.util.UUID;

/**
 * Entry point for the prediction-save workflow: validates the request, then stores
 * the prediction and chains it as one unit.
 */
@Service
@Slf4j
@RequiredArgsConstructor
@Validated
public class PredictionRecordingService {

    private final HashChainLedger ledger;
    private final Clock clock;

    public ChainEntry recordPrediction(@Valid @NotNull RecordPredictionRequest request) {
        String predictionId = StringUtils.hasText(request.getPredictionId())
                ? request.getPredictionId()
                : UUID.randomUUID().toString();
        Instant timestamp = request.getTimestamp() != null ? request.getTimestamp() : Instant.now(clock);

        Prediction prediction = Prediction.builder()
                .id(predictionId)
                .userId(request.getUserId())
                .source(request.getSource())
                .inputFeatures(new LinkedHashMap<>(request.getInputFeatures()))
                .predictionResult(new LinkedHashMap<>(request.getPredictionResult()))
                .timestamp(timestamp.truncatedTo(ChronoUnit.MICROS))
                .build();

        ChainEntry entry = ledger.record(prediction);
        log.info("Recorded prediction {} for user {} at chain sequence {}",
                predictionId, request.getUserId(), entry.getSequence());
        return entry;
    }
}
