package com.mediguard.ledger.exception;

/**
 * Exception thrown when the external anchor ledger rejects or fails a call.
 *
 * Common causes:
 * - RPC endpoint unavailable or timing out
 * - Transaction reverted or never mined within the receipt timeout
 * - Signer refused the transaction
 *
 * Pending entries stay unanchored; the next scheduled cycle retries.
 */
public class AnchorServiceException extends LedgerException {

    private final String mode;
    private final String operation;

    public AnchorServiceException(String message, String mode, String operation) {
        super("ANCHOR_SERVICE_FAILURE",
                String.format("%s (mode=%s, operation=%s)", message, mode, operation));
        this.mode = mode;
        this.operation = operation;
    }

    public AnchorServiceException(String message, String mode, String operation, Throwable cause) {
        super("ANCHOR_SERVICE_FAILURE",
                String.format("%s (mode=%s, operation=%s)", message, mode, operation), cause);
        this.mode = mode;
        this.operation = operation;
    }

    public String getMode() {
        return mode;
    }

    public String getOperation() {
        return operation;
    }
}
