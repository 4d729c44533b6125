package com.mediguard.ledger.anchor;

import java.util.Map;

/**
 * External ledger the chain head is periodically committed to.
 *
 * <p>Implementations are chosen by configuration. Callers never inspect which one
 * answers; committer and lookup logic are identical for all of them.
 */
public interface AnchorService {

    /**
     * Commits the head hash with descriptive metadata.
     *
     * @throws com.mediguard.ledger.exception.AnchorServiceException if the ledger rejects or does not confirm the commit
     */
    AnchorReceipt commit(String headHash, Map<String, Object> metadata);

    AnchorVerification verify(String reference);

    String mode();

    boolean isAvailable();
}
