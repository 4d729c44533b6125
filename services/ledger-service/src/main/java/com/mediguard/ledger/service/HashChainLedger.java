package com.mediguard.ledger.service;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.dto.ChainEntryResponse;
import com.mediguard.ledger.exception.ChainConcurrencyConflictException;
import com.mediguard.ledger.exception.DuplicateChainEntryException;
import com.mediguard.ledger.exception.DuplicatePredictionException;
import com.mediguard.ledger.exception.LedgerStoreException;
import com.mediguard.ledger.exception.PredictionNotFoundException;
import com.mediguard.ledger.integrity.ChainHashCalculator;
import com.mediguard.ledger.repository.ChainEntryRepository;
import com.mediguard.ledger.repository.PredictionRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Append-only prediction hash chain.
 *
 * <p>Every append reads the head, hashes the new payload against it and inserts the
 * next entry as one serialized unit: a process-wide mutex wraps a fresh transaction
 * whose commit happens before the mutex is released. Across processes the sequence
 * primary key and the unique previous_hash column turn a racing insert into a
 * {@link ChainConcurrencyConflictException}, and the whole attempt is retried from a
 * fresh head read.
 */
@Service
@Slf4j
public class HashChainLedger {

    private final ChainEntryRepository chainEntryRepository;
    private final PredictionRepository predictionRepository;
    private final ChainHashCalculator hashCalculator;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final RetryTemplate retryTemplate;
    private final ReentrantLock appendLock = new ReentrantLock(true);

    private final Counter appendCounter;
    private final Counter conflictCounter;

    public HashChainLedger(ChainEntryRepository chainEntryRepository,
                           PredictionRepository predictionRepository,
                           ChainHashCalculator hashCalculator,
                           PlatformTransactionManager transactionManager,
                           LedgerProperties properties,
                           MeterRegistry meterRegistry) {
        this.chainEntryRepository = chainEntryRepository;
        this.predictionRepository = predictionRepository;
        this.hashCalculator = hashCalculator;

        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);

        LedgerProperties.AppendProperties append = properties.getAppend();
        this.retryTemplate = RetryTemplate.builder()
                .maxAttempts(append.getMaxAttempts())
                .fixedBackoff(Math.max(1L, append.getBackoff().toMillis()))
                .retryOn(ChainConcurrencyConflictException.class)
                .build();

        this.appendCounter = Counter.builder("ledger.append.total")
                .description("Chain entries appended")
                .register(meterRegistry);
        this.conflictCounter = Counter.builder("ledger.append.conflicts")
                .description("Appends that lost a race on the chain position and were retried")
                .register(meterRegistry);
    }

    /**
     * Stores a new prediction and chains it in the same transaction. Either both
     * rows exist afterwards or neither does.
     */
    public ChainEntry record(Prediction prediction) {
        if (prediction.getTimestamp() != null) {
            prediction.setTimestamp(prediction.getTimestamp().truncatedTo(ChronoUnit.MICROS));
        }
        return executeSerialized(() -> {
            if (predictionRepository.existsById(prediction.getId())) {
                throw new DuplicatePredictionException(prediction.getId());
            }
            Prediction stored = predictionRepository.saveAndFlush(prediction);
            return appendInCurrentTransaction(stored);
        });
    }

    /**
     * Chains an already stored prediction.
     */
    public ChainEntry append(String predictionId) {
        return executeSerialized(() -> {
            Prediction prediction = predictionRepository.findById(predictionId)
                    .orElseThrow(() -> new PredictionNotFoundException(predictionId));
            return appendInCurrentTransaction(prediction);
        });
    }

    /**
     * Current head hash, null for an empty chain. Not usable as the parent of an
     * append; appends re-read the head inside the critical section.
     */
    public String latestHash() {
        return head().map(ChainEntry::getCurrentHash).orElse(null);
    }

    public Optional<ChainEntry> head() {
        return chainEntryRepository.findFirstByOrderBySequenceDesc();
    }

    public List<ChainEntry> entriesMissingAnchor(int limit) {
        if (limit <= 0) {
            throw new IllegalArgumentException("Limit must be positive: " + limit);
        }
        return chainEntryRepository.findByAnchorReferenceIsNullOrderBySequenceAsc(PageRequest.of(0, limit));
    }

    public long pendingAnchorCount() {
        return chainEntryRepository.countByAnchorReferenceIsNull();
    }

    public List<ChainEntry> findByAnchorReference(String reference) {
        return chainEntryRepository.findByAnchorReferenceOrderBySequenceAsc(reference);
    }

    /**
     * Newest entries first, each joined with a summary of its prediction.
     */
    public Page<ChainEntryResponse> listEntries(Pageable pageable) {
        return readOnlyTemplate.execute(status -> {
            Page<ChainEntry> entries = chainEntryRepository.findAllByOrderBySequenceDesc(
                    PageRequest.of(pageable.getPageNumber(), pageable.getPageSize()));
            List<String> ids = entries.getContent().stream()
                    .map(ChainEntry::getPredictionId)
                    .collect(Collectors.toList());
            Map<String, Prediction> predictions = predictionRepository.findByIdIn(ids).stream()
                    .collect(Collectors.toMap(Prediction::getId, Function.identity()));
            List<ChainEntryResponse> content = entries.getContent().stream()
                    .map(entry -> ChainEntryResponse.from(entry, predictions.get(entry.getPredictionId())))
                    .collect(Collectors.toList());
            return new PageImpl<>(content, entries.getPageable(), entries.getTotalElements());
        });
    }

    /**
     * Runs an action while holding the append lock, so no append can interleave.
     */
    <T> T withAppendLock(Supplier<T> action) {
        appendLock.lock();
        try {
            return action.get();
        } finally {
            appendLock.unlock();
        }
    }

    /**
     * Reads the head and inserts the next entry. Callers must hold the append lock
     * and an open transaction.
     */
    ChainEntry appendInCurrentTransaction(Prediction prediction) {
        if (chainEntryRepository.existsByPredictionId(prediction.getId())) {
            throw new DuplicateChainEntryException(prediction.getId());
        }

        Optional<ChainEntry> head = chainEntryRepository.findFirstByOrderBySequenceDesc();
        long sequence = head.map(entry -> entry.getSequence() + 1).orElse(0L);
        String previousHash = head.map(ChainEntry::getCurrentHash).orElse(null);
        String currentHash = hashCalculator.computeHash(prediction, previousHash);

        ChainEntry entry = ChainEntry.builder()
                .sequence(sequence)
                .predictionId(prediction.getId())
                .previousHash(previousHash)
                .currentHash(currentHash)
                .entryTimestamp(prediction.getTimestamp())
                .build();

        try {
            ChainEntry saved = chainEntryRepository.saveAndFlush(entry);
            appendCounter.increment();
            log.debug("Appended prediction {} at sequence {} with hash {}",
                    prediction.getId(), sequence, currentHash);
            return saved;
        } catch (DataIntegrityViolationException e) {
            conflictCounter.increment();
            log.warn("Chain position {} taken concurrently while appending prediction {}, retrying",
                    sequence, prediction.getId());
            throw new ChainConcurrencyConflictException(sequence, e);
        }
    }

    private ChainEntry executeSerialized(Supplier<ChainEntry> attempt) {
        try {
            return retryTemplate.execute(context -> withAppendLock(
                    () -> transactionTemplate.execute(status -> attempt.get())));
        } catch (ChainConcurrencyConflictException e) {
            log.error("Append abandoned after repeated chain position conflicts: {}", e.getMessage());
            throw e;
        } catch (DataAccessException | TransactionException e) {
            log.error("Ledger store rejected chain append", e);
            throw new LedgerStoreException("Ledger store unavailable: " + e.getMessage(), e);
        }
    }
}
