package com.mediguard.ledger.integrity;

import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.domain.PredictionSource;
import com.mediguard.ledger.exception.LedgerConfigurationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

@DisplayName("Chain Hash Calculator Tests")
class ChainHashCalculatorTest {

    private ChainHashCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new ChainHashCalculator(new CanonicalEncoder(), "SHA-256");
    }

    @Test
    @DisplayName("Should produce lowercase hex SHA-256 digests")
    void shouldDigestToLowercaseHex() {
        assertThat(calculator.digestHex("abc"))
                .isEqualTo("ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad");
    }

    @Test
    @DisplayName("Should hash the canonical document of prediction fields and previous hash")
    void shouldHashCanonicalDocument() {
        Prediction p1 = prediction("p1", "u1", features(45, 5.4), result("Diabetes", 0.87),
                Instant.parse("2024-01-01T00:00:00Z"));

        String expectedDocument = "{\"prediction_data\":{\"input_features\":{\"age\":45,\"glucose\":5.4},"
                + "\"prediction_result\":{\"confidence\":0.87,\"predicted_disease\":\"Diabetes\"}},"
                + "\"prediction_id\":\"p1\",\"previous_hash\":null,"
                + "\"timestamp\":\"2024-01-01T00:00:00.000000Z\",\"user_id\":\"u1\"}";

        assertThat(calculator.getEncoder().encodeToString(ChainPayload.of(p1, null).toDocument()))
                .isEqualTo(expectedDocument);
        assertThat(calculator.computeHash(p1, null)).isEqualTo(calculator.digestHex(expectedDocument));
    }

    @Test
    @DisplayName("Should link P2 to P1 through the previous hash")
    void shouldChainTwoPredictions() {
        Prediction p1 = prediction("p1", "u1", features(45, 5.4), result("Diabetes", 0.87),
                Instant.parse("2024-01-01T00:00:00Z"));
        Prediction p2 = prediction("p2", "u1", features(61, 7.9), result("Heart Disease", 0.64),
                Instant.parse("2024-01-02T00:00:00Z"));

        String h1 = calculator.computeHash(p1, null);
        String h2 = calculator.computeHash(p2, h1);

        assertThat(h1).hasSize(64).matches("[0-9a-f]+");
        assertThat(h2).hasSize(64).isNotEqualTo(h1);
        assertThat(h2).isNotEqualTo(calculator.computeHash(p2, null));
        assertThat(calculator.computeHash(p2, h1)).isEqualTo(h2);
    }

    @Test
    @DisplayName("Should depend on logical content only")
    void shouldIgnoreRepresentationDifferences() {
        Map<String, Object> integral = new LinkedHashMap<>();
        integral.put("glucose", 5.4);
        integral.put("age", 45);
        Map<String, Object> decimal = new LinkedHashMap<>();
        decimal.put("age", 45.0);
        decimal.put("glucose", 5.40);

        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        String first = calculator.computeHash(prediction("p1", "u1", integral, result("Diabetes", 0.87), at), null);
        String second = calculator.computeHash(prediction("p1", "u1", decimal, result("Diabetes", 0.87), at), null);

        assertThat(first).isEqualTo(second);
    }

    @Test
    @DisplayName("Should change when any feature value changes")
    void shouldDetectPayloadChanges() {
        Instant at = Instant.parse("2024-01-01T00:00:00Z");
        String original = calculator.computeHash(
                prediction("p1", "u1", features(45, 5.4), result("Diabetes", 0.87), at), null);
        String altered = calculator.computeHash(
                prediction("p1", "u1", features(45, 5.5), result("Diabetes", 0.87), at), null);

        assertThat(altered).isNotEqualTo(original);
    }

    @Test
    @DisplayName("Should accept other 256-bit algorithms")
    void shouldAcceptSha3() {
        ChainHashCalculator sha3 = new ChainHashCalculator(new CanonicalEncoder(), "SHA3-256");

        assertThat(sha3.digestHex("abc")).hasSize(64).isNotEqualTo(calculator.digestHex("abc"));
    }

    @Test
    @DisplayName("Should reject algorithms that do not yield 256 bits")
    void shouldRejectWrongDigestLength() {
        assertThatThrownBy(() -> new ChainHashCalculator(new CanonicalEncoder(), "SHA-512"))
                .isInstanceOf(LedgerConfigurationException.class)
                .hasMessageContaining("512");
        assertThatThrownBy(() -> new ChainHashCalculator(new CanonicalEncoder(), "NO-SUCH-DIGEST"))
                .isInstanceOf(LedgerConfigurationException.class);
    }

    private static Prediction prediction(String id, String userId, Map<String, Object> features,
                                         Map<String, Object> result, Instant timestamp) {
        return Prediction.builder()
                .id(id)
                .userId(userId)
                .source(PredictionSource.MANUAL)
                .inputFeatures(features)
                .predictionResult(result)
                .timestamp(timestamp)
                .build();
    }

    private static Map<String, Object> features(int age, double glucose) {
        Map<String, Object> features = new LinkedHashMap<>();
        features.put("age", age);
        features.put("glucose", glucose);
        return features;
    }

    private static Map<String, Object> result(String disease, double confidence) {
        Map<String, Object> result = new LinkedHashMap<>();
        result.put("predicted_disease", disease);
        result.put("confidence", confidence);
        return result;
    }
}
