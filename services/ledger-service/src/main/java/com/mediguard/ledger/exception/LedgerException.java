package com.mediguard.ledger.exception;

/**
 * Base exception for all ledger service exceptions
 * Carries a stable error code for programmatic handling
 */
public class LedgerException extends RuntimeException {

    private final String errorCode;
    private final Object[] args;

    public LedgerException(String message) {
        super(message);
        this.errorCode = "LEDGER_ERROR";
        this.args = null;
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
        this.errorCode = "LEDGER_ERROR";
        this.args = null;
    }

    public LedgerException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.args = null;
    }

    public LedgerException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.args = null;
    }

    public LedgerException(String errorCode, String message, Object... args) {
        super(message);
        this.errorCode = errorCode;
        this.args = args;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Object[] getArgs() {
        return args;
    }
}
