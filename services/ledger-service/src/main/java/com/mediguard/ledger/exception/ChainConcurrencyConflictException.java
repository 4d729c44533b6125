package com.mediguard.ledger.exception;

/**
 * Thrown when a conditional chain insert collides with a concurrent append.
 * Recovered by retrying the whole read-head/compute-hash/insert sequence.
 */
public class ChainConcurrencyConflictException extends LedgerException {

    public ChainConcurrencyConflictException(long sequence, Throwable cause) {
        super("CONCURRENCY_CONFLICT", "Chain position " + sequence + " was taken by a concurrent append", cause);
    }
}
