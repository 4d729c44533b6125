package com.mediguard.ledger.scheduler;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.dto.ChainRebuildReport;
import com.mediguard.ledger.exception.ChainIntegrityViolationException;
import com.mediguard.ledger.service.ChainRebuildService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Operator-invoked rebuild at startup.
 *
 * <p>Needs both {@code ledger.rebuild.run=true} and {@code ledger.rebuild.confirmed=true};
 * with only the first set it refuses and logs what is missing.
 */
@Component
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.rebuild", name = "run", havingValue = "true")
public class ChainRebuildRunner implements ApplicationRunner {

    private final ChainRebuildService rebuildService;
    private final LedgerProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        if (!Boolean.TRUE.equals(properties.getRebuild().getConfirmed())) {
            log.warn("Chain rebuild requested but not confirmed. It deletes every chain entry and anchor; "
                    + "set ledger.rebuild.confirmed=true to proceed");
            return;
        }

        try {
            ChainRebuildReport report = rebuildService.rebuild();
            log.info("Chain rebuild PASSED: {} entries rebuilt, {} removed",
                    report.getRebuiltEntries(), report.getDeletedEntries());
        } catch (ChainIntegrityViolationException e) {
            log.error("Chain rebuild FAILED verification: {}", e.getReport().getErrors());
            throw e;
        }
    }
}
