package com.mediguard.ledger.exception;

/**
 * Thrown when external connection details or integrity settings are missing or invalid.
 * Fatal at startup: no chain operation proceeds with a broken configuration.
 */
public class LedgerConfigurationException extends LedgerException {

    public LedgerConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }

    public LedgerConfigurationException(String message, Throwable cause) {
        super("CONFIGURATION_ERROR", message, cause);
    }
}
