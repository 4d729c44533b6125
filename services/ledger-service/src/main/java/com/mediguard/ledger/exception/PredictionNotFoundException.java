package com.mediguard.ledger.exception;

/**
 * Exception thrown when a prediction referenced by an append does not exist
 * Results in HTTP 404 Not Found
 */
public class PredictionNotFoundException extends LedgerException {

    public PredictionNotFoundException(String predictionId) {
        super("PREDICTION_NOT_FOUND", "Prediction not found with ID: " + predictionId, predictionId);
    }
}
