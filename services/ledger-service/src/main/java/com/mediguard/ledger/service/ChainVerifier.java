package com.mediguard.ledger.service;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.dto.ChainDiscrepancy;
import com.mediguard.ledger.dto.ChainVerificationReport;
import com.mediguard.ledger.dto.DiscrepancyType;
import com.mediguard.ledger.integrity.ChainHashCalculator;
import com.mediguard.ledger.repository.ChainEntryRepository;
import com.mediguard.ledger.repository.PredictionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Replays the chain from genesis and reports every broken link or altered payload.
 *
 * <p>The upper sequence bound is fixed when a run starts; entries appended during the
 * scan belong to the next run. Verification only reads and never repairs anything.
 */
@Service
@Slf4j
public class ChainVerifier {

    private final ChainEntryRepository chainEntryRepository;
    private final PredictionRepository predictionRepository;
    private final ChainHashCalculator hashCalculator;
    private final Clock clock;
    private final int pageSize;
    private final Counter failureCounter;

    public ChainVerifier(ChainEntryRepository chainEntryRepository,
                         PredictionRepository predictionRepository,
                         ChainHashCalculator hashCalculator,
                         Clock clock,
                         LedgerProperties properties,
                         MeterRegistry meterRegistry) {
        this.chainEntryRepository = chainEntryRepository;
        this.predictionRepository = predictionRepository;
        this.hashCalculator = hashCalculator;
        this.clock = clock;
        this.pageSize = properties.getVerification().getPageSize();
        this.failureCounter = Counter.builder("ledger.verification.failures")
                .description("Verification runs that found the chain broken")
                .register(meterRegistry);
    }

    public ChainVerificationReport verify() {
        Optional<ChainEntry> head = chainEntryRepository.findFirstByOrderBySequenceDesc();
        if (head.isEmpty()) {
            return ChainVerificationReport.builder()
                    .valid(true)
                    .totalEntries(0)
                    .errors(List.of())
                    .discrepancies(List.of())
                    .message("Chain is empty")
                    .verifiedAt(Instant.now(clock))
                    .build();
        }

        long upTo = head.get().getSequence();
        List<ChainDiscrepancy> discrepancies = new ArrayList<>();
        String previousHash = null;
        boolean first = true;
        int total = 0;
        long after = -1L;

        while (true) {
            List<ChainEntry> page = chainEntryRepository.findRange(after, upTo, PageRequest.of(0, pageSize));
            if (page.isEmpty()) {
                break;
            }
            Map<String, Prediction> predictions = loadPredictions(page);

            for (ChainEntry entry : page) {
                total++;
                Prediction prediction = predictions.get(entry.getPredictionId());
                if (prediction == null) {
                    discrepancies.add(ChainDiscrepancy.builder()
                            .sequence(entry.getSequence())
                            .predictionId(entry.getPredictionId())
                            .type(DiscrepancyType.PREDICTION_NOT_FOUND)
                            .build());
                    first = false;
                    continue;
                }

                if (first ? entry.getPreviousHash() != null : !Objects.equals(entry.getPreviousHash(), previousHash)) {
                    discrepancies.add(ChainDiscrepancy.builder()
                            .sequence(entry.getSequence())
                            .predictionId(entry.getPredictionId())
                            .type(DiscrepancyType.LINK_MISMATCH)
                            .expected(first ? null : previousHash)
                            .actual(entry.getPreviousHash())
                            .build());
                }

                String recomputed = hashCalculator.computeHash(prediction, entry.getPreviousHash());
                if (!recomputed.equals(entry.getCurrentHash())) {
                    discrepancies.add(ChainDiscrepancy.builder()
                            .sequence(entry.getSequence())
                            .predictionId(entry.getPredictionId())
                            .type(DiscrepancyType.HASH_MISMATCH)
                            .expected(recomputed)
                            .actual(entry.getCurrentHash())
                            .build());
                }

                previousHash = entry.getCurrentHash();
                first = false;
            }
            after = page.get(page.size() - 1).getSequence();
        }

        boolean valid = discrepancies.isEmpty();
        List<String> errors = discrepancies.stream()
                .map(ChainDiscrepancy::describe)
                .collect(Collectors.toList());

        if (valid) {
            log.info("Hash chain verified: {} entries intact up to sequence {}", total, upTo);
        } else {
            failureCounter.increment();
            log.error("Hash chain verification failed with {} discrepancies over {} entries: {}",
                    discrepancies.size(), total, errors);
        }

        return ChainVerificationReport.builder()
                .valid(valid)
                .totalEntries(total)
                .errors(errors)
                .discrepancies(discrepancies)
                .headHash(head.get().getCurrentHash())
                .message(valid ? "Chain integrity verified" : "Chain integrity compromised")
                .verifiedAt(Instant.now(clock))
                .build();
    }

    private Map<String, Prediction> loadPredictions(List<ChainEntry> page) {
        List<String> ids = page.stream().map(ChainEntry::getPredictionId).collect(Collectors.toList());
        return predictionRepository.findByIdIn(ids).stream()
                .collect(Collectors.toMap(Prediction::getId, Function.identity()));
    }
}
