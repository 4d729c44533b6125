package com.mediguard.ledger.service;

import com.mediguard.ledger.anchor.AnchorService;
import com.mediguard.ledger.anchor.AnchorVerification;
import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.dto.AnchorCycleResult;
import com.mediguard.ledger.dto.AnchorLookupResponse;
import com.mediguard.ledger.dto.AnchorStatusResponse;
import com.mediguard.ledger.exception.AnchorReferenceNotFoundException;
import com.mediguard.ledger.exception.AnchorServiceException;
import com.mediguard.ledger.scheduler.AnchorCommitScheduler;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Read side of anchoring: scheduler status and per-transaction lookups
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AnchorQueryService {

    private final HashChainLedger ledger;
    private final AnchorService anchorService;
    private final AnchorCommitService commitService;
    private final AnchorCommitScheduler scheduler;
    private final LedgerProperties properties;

    public AnchorStatusResponse status() {
        AnchorStatusResponse.AnchorStatusResponseBuilder builder = AnchorStatusResponse.builder()
                .mode(anchorService.mode())
                .schedulerState(scheduler.getState().name())
                .interval(properties.getAnchor().getInterval())
                .serviceAvailable(anchorService.isAvailable())
                .pendingEntries(ledger.pendingAnchorCount());

        commitService.lastResult().ifPresent(last -> builder
                .lastCycleOutcome(last.getOutcome().name())
                .lastCycleAt(last.getCompletedAt())
                .lastAnchorReference(last.getReference())
                .lastError(last.getOutcome() == AnchorCycleResult.Outcome.FAILED ? last.getError() : null));
        return builder.build();
    }

    /**
     * Entries stamped with the reference, plus what the anchor ledger reports for it.
     */
    public AnchorLookupResponse lookup(String reference) {
        List<ChainEntry> entries = ledger.findByAnchorReference(reference);
        if (entries.isEmpty()) {
            throw new AnchorReferenceNotFoundException(reference);
        }
        ChainEntry first = entries.get(0);
        ChainEntry last = entries.get(entries.size() - 1);

        AnchorLookupResponse.AnchorLookupResponseBuilder builder = AnchorLookupResponse.builder()
                .reference(reference)
                .anchorPosition(last.getAnchorPosition())
                .entryCount(entries.size())
                .firstSequence(first.getSequence())
                .lastSequence(last.getSequence())
                .lastHash(last.getCurrentHash())
                .mode(anchorService.mode());

        try {
            AnchorVerification verification = anchorService.verify(reference);
            builder.foundOnLedger(verification.isFound())
                    .ledgerPosition(verification.getPosition())
                    .rawData(verification.getRawData());
        } catch (AnchorServiceException e) {
            log.warn("Anchor ledger lookup for {} failed: {}", reference, e.getMessage());
            throw e;
        }
        return builder.build();
    }
}
