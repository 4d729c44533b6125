package com.mediguard.ledger.exception;

import com.mediguard.ledger.dto.ChainVerificationReport;

/**
 * Thrown when the verifier finds the chain broken where the caller requires it intact.
 * Never auto-corrected; requires an operator-invoked rebuild.
 */
public class ChainIntegrityViolationException extends LedgerException {

    private final transient ChainVerificationReport report;

    public ChainIntegrityViolationException(ChainVerificationReport report) {
        super("INTEGRITY_VIOLATION",
                String.format("Hash chain verification failed with %d error(s) over %d entries",
                        report.getErrors().size(), report.getTotalEntries()));
        this.report = report;
    }

    public ChainVerificationReport getReport() {
        return report;
    }
}
