package com.mediguard.ledger.kafka;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.dto.RecordPredictionRequest;
import com.mediguard.ledger.exception.DuplicatePredictionException;
import com.mediguard.ledger.service.PredictionRecordingService;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.kafka.annotation.KafkaListener;
import org.springframework.kafka.support.Acknowledgment;
import org.springframework.kafka.support.KafkaHeaders;
import org.springframework.messaging.handler.annotation.Header;
import org.springframework.messaging.handler.annotation.Payload;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.util.Set;
import java.util.stream.Collectors;

/**
 * Chains predictions announced on the prediction-recorded topic.
 *
 * <p>Idempotent on prediction id: a redelivered event for a prediction that is
 * already stored is acknowledged and skipped. Malformed events are acknowledged and
 * dropped; store failures are left unacknowledged for redelivery.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.kafka", name = "enabled", havingValue = "true")
public class PredictionRecordedEventConsumer {

    private final PredictionRecordingService recordingService;
    private final ObjectMapper objectMapper;
    private final Validator validator;
    private final MeterRegistry meterRegistry;

    private Counter processedCounter;
    private Counter duplicateCounter;
    private Counter rejectedCounter;

    @PostConstruct
    public void initMetrics() {
        processedCounter = Counter.builder("ledger.kafka.predictions.processed")
                .description("Prediction events chained")
                .register(meterRegistry);
        duplicateCounter = Counter.builder("ledger.kafka.predictions.duplicates")
                .description("Redelivered prediction events skipped")
                .register(meterRegistry);
        rejectedCounter = Counter.builder("ledger.kafka.predictions.rejected")
                .description("Malformed prediction events dropped")
                .register(meterRegistry);
    }

    @KafkaListener(
        topics = "${ledger.kafka.prediction-topic}",
        groupId = "${ledger.kafka.group-id}"
    )
    public void handlePredictionRecorded(
            @Payload String message,
            @Header(KafkaHeaders.RECEIVED_PARTITION) int partition,
            @Header(KafkaHeaders.OFFSET) long offset,
            Acknowledgment acknowledgment) {

        log.debug("Received prediction event: partition={}, offset={}", partition, offset);

        RecordPredictionRequest request;
        try {
            request = objectMapper.readValue(message, RecordPredictionRequest.class);
        } catch (JsonProcessingException e) {
            log.error("Dropping unreadable prediction event at partition={}, offset={}: {}",
                    partition, offset, e.getOriginalMessage());
            rejectedCounter.increment();
            acknowledgment.acknowledge();
            return;
        }

        String problems = validate(request);
        if (problems != null) {
            log.error("Dropping invalid prediction event at partition={}, offset={}: {}", partition, offset, problems);
            rejectedCounter.increment();
            acknowledgment.acknowledge();
            return;
        }

        try {
            ChainEntry entry = recordingService.recordPrediction(request);
            processedCounter.increment();
            log.info("Prediction event {} chained at sequence {}", request.getPredictionId(), entry.getSequence());
        } catch (DuplicatePredictionException e) {
            duplicateCounter.increment();
            log.info("Prediction {} already recorded, skipping redelivered event", request.getPredictionId());
        }
        acknowledgment.acknowledge();
    }

    private String validate(RecordPredictionRequest request) {
        if (!StringUtils.hasText(request.getPredictionId())) {
            return "prediction_id is required on events";
        }
        Set<ConstraintViolation<RecordPredictionRequest>> violations = validator.validate(request);
        if (violations.isEmpty()) {
            return null;
        }
        return violations.stream()
                .map(v -> v.getPropertyPath() + " " + v.getMessage())
                .sorted()
                .collect(Collectors.joining(", "));
    }
}
