package com.mediguard.ledger;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Prediction Ledger Service
 *
 * Tamper-evident audit trail for disease-risk predictions:
 * - Hash chain linking every stored prediction into an append-only sequence
 * - On-demand verification of link and content integrity from genesis
 * - Periodic anchoring of the chain head to an external ledger
 * - Operator-invoked rebuild of the chain from the stored predictions
 */
@SpringBootApplication
public class LedgerServiceApplication {

    public static void main(String[] args) {
        SpringApplication.run(LedgerServiceApplication.class, args);
    }
}
