package com.mediguard.ledger.service;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.dto.ChainRebuildReport;
import com.mediguard.ledger.dto.ChainVerificationReport;
import com.mediguard.ledger.exception.ChainIntegrityViolationException;
import com.mediguard.ledger.exception.LedgerStoreException;
import com.mediguard.ledger.repository.ChainEntryRepository;
import com.mediguard.ledger.repository.PredictionRepository;
import jakarta.persistence.EntityManager;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Slice;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Regenerates the whole chain from the stored predictions.
 *
 * <p>Destructive: every entry and its anchor assignment is discarded. Callers are
 * responsible for obtaining operator confirmation before invoking it.
 */
@Service
@Slf4j
public class ChainRebuildService {

    private final HashChainLedger ledger;
    private final ChainVerifier verifier;
    private final ChainEntryRepository chainEntryRepository;
    private final PredictionRepository predictionRepository;
    private final EntityManager entityManager;
    private final TransactionTemplate transactionTemplate;
    private final int pageSize;

    public ChainRebuildService(HashChainLedger ledger,
                               ChainVerifier verifier,
                               ChainEntryRepository chainEntryRepository,
                               PredictionRepository predictionRepository,
                               EntityManager entityManager,
                               PlatformTransactionManager transactionManager,
                               LedgerProperties properties) {
        this.ledger = ledger;
        this.verifier = verifier;
        this.chainEntryRepository = chainEntryRepository;
        this.predictionRepository = predictionRepository;
        this.entityManager = entityManager;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.pageSize = properties.getRebuild().getPageSize();
    }

    /**
     * Deletes all entries, replays every prediction in (timestamp, created_at) order
     * and verifies the result.
     *
     * @throws ChainIntegrityViolationException if the rebuilt chain does not verify
     */
    public ChainRebuildReport rebuild() {
        log.warn("Rebuilding hash chain from stored predictions; all existing entries and anchors are discarded");

        long[] counts;
        try {
            counts = ledger.withAppendLock(() -> transactionTemplate.execute(status -> replay()));
        } catch (DataAccessException e) {
            throw new LedgerStoreException("Chain rebuild failed: " + e.getMessage(), e);
        }

        ChainVerificationReport verification = verifier.verify();
        if (!verification.isValid()) {
            log.error("Rebuilt chain failed verification: {}", verification.getErrors());
            throw new ChainIntegrityViolationException(verification);
        }

        log.info("Hash chain rebuilt: {} entries removed, {} entries chained, verification passed",
                counts[0], counts[1]);
        return ChainRebuildReport.builder()
                .deletedEntries(counts[0])
                .rebuiltEntries(counts[1])
                .verification(verification)
                .build();
    }

    private long[] replay() {
        long deleted = chainEntryRepository.count();
        chainEntryRepository.deleteAllInBatch();

        long rebuilt = 0;
        Pageable pageable = PageRequest.of(0, pageSize);
        Slice<Prediction> slice;
        do {
            slice = predictionRepository.findInReplayOrder(pageable);
            for (Prediction prediction : slice) {
                ledger.appendInCurrentTransaction(prediction);
                rebuilt++;
            }
            // keep the persistence context bounded to one page
            entityManager.flush();
            entityManager.clear();
            log.debug("Rebuild replayed {} predictions so far", rebuilt);
            pageable = slice.nextPageable();
        } while (slice.hasNext());

        return new long[]{deleted, rebuilt};
    }
}
