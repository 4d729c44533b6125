package com.mediguard.ledger.scheduler;

import com.mediguard.ledger.dto.ChainVerificationReport;
import com.mediguard.ledger.service.ChainVerifier;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.EnableScheduling;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Periodic integrity check of the whole chain. Findings are logged, never repaired.
 */
@Component
@EnableScheduling
@Slf4j
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "ledger.verification", name = "periodic-verification", havingValue = "true")
public class ChainVerificationScheduler {

    private final ChainVerifier verifier;

    @Scheduled(fixedDelayString = "${ledger.verification.verification-interval:PT24H}",
               initialDelayString = "${ledger.verification.verification-interval:PT24H}")
    public void verifyChain() {
        log.info("Starting scheduled hash chain verification");
        try {
            ChainVerificationReport report = verifier.verify();
            if (!report.isValid()) {
                log.error("CRITICAL: scheduled verification found {} chain discrepancies: {}",
                        report.getErrors().size(), report.getErrors());
            }
        } catch (Exception e) {
            log.error("Scheduled hash chain verification could not complete", e);
        }
    }
}
