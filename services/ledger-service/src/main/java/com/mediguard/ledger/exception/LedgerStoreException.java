package com.mediguard.ledger.exception;

/**
 * Exception thrown when the underlying store rejects or cannot serve a chain operation
 * Results in HTTP 503 Service Unavailable
 */
public class LedgerStoreException extends LedgerException {

    public LedgerStoreException(String message, Throwable cause) {
        super("LEDGER_STORE_UNAVAILABLE", message, cause);
    }
}
