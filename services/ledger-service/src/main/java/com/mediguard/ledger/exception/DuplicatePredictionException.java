package com.mediguard.ledger.exception;

/**
 * Exception thrown when recording a prediction whose identifier is already stored
 * Results in HTTP 409 Conflict
 */
public class DuplicatePredictionException extends LedgerException {

    public DuplicatePredictionException(String predictionId) {
        super("DUPLICATE_PREDICTION", "Prediction already exists with ID: " + predictionId, predictionId);
    }
}
