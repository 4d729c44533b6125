package com.mediguard.ledger.exception;

/**
 * Exception thrown when a prediction that is already chained is appended again
 * Results in HTTP 409 Conflict
 */
public class DuplicateChainEntryException extends LedgerException {

    public DuplicateChainEntryException(String predictionId) {
        super("DUPLICATE_CHAIN_ENTRY", "Prediction is already chained: " + predictionId, predictionId);
    }
}
