package com.mediguard.ledger.service;

import com.mediguard.ledger.anchor.AnchorReceipt;
import com.mediguard.ledger.anchor.AnchorService;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.dto.AnchorCycleResult;
import com.mediguard.ledger.exception.LedgerException;
import com.mediguard.ledger.integrity.CanonicalEncoder;
import com.mediguard.ledger.repository.ChainEntryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One anchor commit cycle: snapshot the head, commit it externally, then stamp the
 * reference on exactly the entries that were pending in the snapshot.
 *
 * <p>Never throws. A failed cycle leaves every pending entry unanchored and is
 * retried from a fresh snapshot on the next run.
 */
@Service
@Slf4j
public class AnchorCommitService {

    private final HashChainLedger ledger;
    private final ChainEntryRepository chainEntryRepository;
    private final AnchorService anchorService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final Timer commitTimer;
    private final AtomicReference<AnchorCycleResult> lastResult = new AtomicReference<>();
    private final ReentrantLock cycleLock = new ReentrantLock();

    public AnchorCommitService(HashChainLedger ledger,
                               ChainEntryRepository chainEntryRepository,
                               AnchorService anchorService,
                               PlatformTransactionManager transactionManager,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        this.ledger = ledger;
        this.chainEntryRepository = chainEntryRepository;
        this.anchorService = anchorService;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.transactionTemplate.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.clock = clock;
        this.meterRegistry = meterRegistry;
        this.commitTimer = Timer.builder("ledger.anchor.commit.duration")
                .description("Time spent in external anchor commits")
                .register(meterRegistry);
    }

    /**
     * Runs one cycle. Cycles never overlap; a caller arriving during a cycle waits
     * for it and then usually finds nothing pending.
     */
    public AnchorCycleResult commitPendingEntries() {
        cycleLock.lock();
        try {
            AnchorCycleResult result;
            try {
                result = runCycle();
            } catch (Exception e) {
                log.error("Anchor commit cycle failed, pending entries stay unanchored until the next cycle", e);
                result = AnchorCycleResult.builder()
                        .outcome(AnchorCycleResult.Outcome.FAILED)
                        .error(e.getMessage())
                        .completedAt(Instant.now(clock))
                        .build();
            }
            lastResult.set(result);
            cycleCounter(result.getOutcome()).increment();
            return result;
        } finally {
            cycleLock.unlock();
        }
    }

    public Optional<AnchorCycleResult> lastResult() {
        return Optional.ofNullable(lastResult.get());
    }

    public String anchorMode() {
        return anchorService.mode();
    }

    private AnchorCycleResult runCycle() {
        Optional<ChainEntry> head = ledger.head();
        long pending = head
                .map(entry -> chainEntryRepository.countByAnchorReferenceIsNullAndSequenceLessThanEqual(entry.getSequence()))
                .orElse(0L);
        if (pending == 0) {
            log.debug("No unanchored chain entries, nothing to commit");
            return AnchorCycleResult.builder()
                    .outcome(AnchorCycleResult.Outcome.NO_PENDING)
                    .completedAt(Instant.now(clock))
                    .build();
        }

        ChainEntry headEntry = head.get();
        long bound = headEntry.getSequence();
        List<ChainEntry> oldest = ledger.entriesMissingAnchor(1);
        long firstSequence = oldest.isEmpty() ? bound : oldest.get(0).getSequence();

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("total_entries", pending);
        metadata.put("first_sequence", firstSequence);
        metadata.put("last_sequence", bound);
        metadata.put("timestamp", CanonicalEncoder.formatTimestamp(Instant.now(clock)));

        log.info("Committing chain head {} covering {} entries ({}..{}) via {} anchor",
                headEntry.getCurrentHash(), pending, firstSequence, bound, anchorService.mode());
        AnchorReceipt receipt = commitTimer.record(() -> anchorService.commit(headEntry.getCurrentHash(), metadata));

        Integer updated = transactionTemplate.execute(status -> {
            int count = chainEntryRepository.markAnchored(receipt.getReference(), receipt.getPosition(), bound);
            if (count != pending) {
                throw new LedgerException("ANCHOR_BATCH_MISMATCH", String.format(
                        "Anchor %s would cover %d entries but %d were pending up to sequence %d",
                        receipt.getReference(), count, pending, bound));
            }
            return count;
        });

        log.info("Anchored {} entries up to sequence {} with reference {} at position {}",
                updated, bound, receipt.getReference(), receipt.getPosition());
        return AnchorCycleResult.builder()
                .outcome(AnchorCycleResult.Outcome.COMMITTED)
                .headHash(headEntry.getCurrentHash())
                .reference(receipt.getReference())
                .position(receipt.getPosition())
                .anchoredEntries(pending)
                .firstSequence(firstSequence)
                .lastSequence(bound)
                .completedAt(Instant.now(clock))
                .build();
    }

    private Counter cycleCounter(AnchorCycleResult.Outcome outcome) {
        return Counter.builder("ledger.anchor.cycles")
                .description("Anchor commit cycles by outcome")
                .tag("result", outcome.name().toLowerCase())
                .register(meterRegistry);
    }
}
