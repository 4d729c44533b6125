package com.mediguard.ledger.service;

import com.mediguard.ledger.BaseLedgerIntegrationTest;
import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.dto.ChainDiscrepancy;
import com.mediguard.ledger.dto.ChainVerificationReport;
import com.mediguard.ledger.dto.DiscrepancyType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Chain Verifier Tests")
class ChainVerifierIntegrationTest extends BaseLedgerIntegrationTest {

    @Autowired
    private ChainVerifier verifier;

    @Test
    @DisplayName("Should treat an empty chain as valid")
    void shouldAcceptEmptyChain() {
        ChainVerificationReport report = verifier.verify();

        assertThat(report.isValid()).isTrue();
        assertThat(report.getTotalEntries()).isZero();
        assertThat(report.getErrors()).isEmpty();
    }

    @Test
    @DisplayName("Should report exactly one hash mismatch when a stored payload is altered")
    void shouldDetectAlteredPayload() {
        // Given
        for (int i = 0; i < 6; i++) {
            recordPrediction("tamper-" + i, BASE_TIME.plusSeconds(i));
        }
        jdbcTemplate.update("UPDATE predictions SET prediction_result = ? WHERE id = ?",
                "{\"predicted_disease\":\"Healthy\",\"confidence\":0.99}", "tamper-3");

        // When
        ChainVerificationReport report = verifier.verify();

        // Then
        assertThat(report.isValid()).isFalse();
        assertThat(report.getTotalEntries()).isEqualTo(6);
        assertThat(report.getErrors()).hasSize(1);
        assertThat(report.getErrors().get(0)).startsWith("Entry 3: Hash mismatch");
        assertThat(report.getDiscrepancies())
                .extracting(ChainDiscrepancy::getType, ChainDiscrepancy::getSequence)
                .containsExactly(tuple(DiscrepancyType.HASH_MISMATCH, 3L));
    }

    @Test
    @DisplayName("Should detect a change in the ninth decimal of a stored value")
    void shouldDetectNinthDecimalChange() {
        // Given
        recordPrediction("precise-0", BASE_TIME);
        Prediction precise = newPrediction("precise-1", BASE_TIME.plusSeconds(1));
        precise.getPredictionResult().put("confidence", 0.123456781);
        ledger.record(precise);
        recordPrediction("precise-2", BASE_TIME.plusSeconds(2));

        assertThat(verifier.verify().isValid()).isTrue();

        // When
        jdbcTemplate.update("UPDATE predictions SET prediction_result = ? WHERE id = ?",
                "{\"predicted_disease\":\"" + precise.getPredictionResult().get("predicted_disease")
                        + "\",\"confidence\":0.123456784}", "precise-1");
        ChainVerificationReport report = verifier.verify();

        // Then
        assertThat(report.isValid()).isFalse();
        assertThat(report.getDiscrepancies())
                .extracting(ChainDiscrepancy::getType, ChainDiscrepancy::getSequence)
                .containsExactly(tuple(DiscrepancyType.HASH_MISMATCH, 1L));
    }

    @Test
    @DisplayName("Should report a broken link at the exact position without cascading")
    void shouldDetectBrokenLink() {
        for (int i = 0; i < 5; i++) {
            recordPrediction("link-" + i, BASE_TIME.plusSeconds(i));
        }
        jdbcTemplate.update("UPDATE hash_chain SET previous_hash = ? WHERE sequence = ?",
                "0000000000000000000000000000000000000000000000000000000000000000", 2L);

        ChainVerificationReport report = verifier.verify();

        assertThat(report.isValid()).isFalse();
        assertThat(report.getDiscrepancies())
                .extracting(ChainDiscrepancy::getType, ChainDiscrepancy::getSequence)
                .containsExactly(
                        tuple(DiscrepancyType.LINK_MISMATCH, 2L),
                        tuple(DiscrepancyType.HASH_MISMATCH, 2L));
    }

    @Test
    @DisplayName("Should report a missing prediction and not use its entry as a predecessor")
    void shouldDetectMissingPrediction() {
        for (int i = 0; i < 4; i++) {
            recordPrediction("gone-" + i, BASE_TIME.plusSeconds(i));
        }
        predictionRepository.deleteById("gone-1");

        ChainVerificationReport report = verifier.verify();

        assertThat(report.isValid()).isFalse();
        assertThat(report.getTotalEntries()).isEqualTo(4);
        assertThat(report.getErrors().get(0)).isEqualTo("Entry 1: Prediction gone-1 not found");
        assertThat(report.getDiscrepancies())
                .extracting(ChainDiscrepancy::getType, ChainDiscrepancy::getSequence)
                .containsExactly(
                        tuple(DiscrepancyType.PREDICTION_NOT_FOUND, 1L),
                        tuple(DiscrepancyType.LINK_MISMATCH, 2L));
    }

    @Test
    @DisplayName("Should flag a genesis entry that claims a parent")
    void shouldDetectGenesisWithParent() {
        recordPrediction("genesis", BASE_TIME);
        recordPrediction("second", BASE_TIME.plusSeconds(1));
        jdbcTemplate.update("UPDATE hash_chain SET previous_hash = ? WHERE sequence = ?", "feedface", 0L);

        ChainVerificationReport report = verifier.verify();

        assertThat(report.getDiscrepancies())
                .extracting(ChainDiscrepancy::getType, ChainDiscrepancy::getSequence)
                .containsExactly(
                        tuple(DiscrepancyType.LINK_MISMATCH, 0L),
                        tuple(DiscrepancyType.HASH_MISMATCH, 0L));
    }

    @Test
    @DisplayName("Should verify across several pages and report the head hash")
    void shouldVerifyAcrossPages() {
        for (int i = 0; i < 8; i++) {
            recordPrediction("page-" + i, BASE_TIME.plusSeconds(i));
        }

        ChainVerificationReport report = verifier.verify();

        assertThat(report.isValid()).isTrue();
        assertThat(report.getTotalEntries()).isEqualTo(8);
        assertThat(report.getHeadHash()).isEqualTo(ledger.latestHash());
    }
}
