package com.mediguard.ledger.exception;

/**
 * Exception thrown when no chain entry carries the requested anchor reference
 * Results in HTTP 404 Not Found
 */
public class AnchorReferenceNotFoundException extends LedgerException {

    public AnchorReferenceNotFoundException(String reference) {
        super("ANCHOR_NOT_FOUND", "No chain entries anchored with reference: " + reference, reference);
    }
}
