package com.mediguard.ledger.anchor;

import com.mediguard.ledger.service.HashChainLedger;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports whether the anchor ledger is reachable, with the current backlog
 */
@Component("anchorLedger")
@RequiredArgsConstructor
public class AnchorServiceHealthIndicator implements HealthIndicator {

    private final AnchorService anchorService;
    private final HashChainLedger ledger;

    @Override
    public Health health() {
        Health.Builder builder = anchorService.isAvailable() ? Health.up() : Health.down();
        return builder
                .withDetail("mode", anchorService.mode())
                .withDetail("pendingEntries", ledger.pendingAnchorCount())
                .build();
    }
}
