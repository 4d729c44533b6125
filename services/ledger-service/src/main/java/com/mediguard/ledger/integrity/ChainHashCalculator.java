package com.mediguard.ledger.integrity;

import com.mediguard.ledger.config.LedgerProperties;
import com.mediguard.ledger.domain.Prediction;
import com.mediguard.ledger.exception.LedgerConfigurationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * Computes chain hashes: digest(canonical({prediction_id, user_id, prediction_data, timestamp, previous_hash}))
 */
@Component
@Slf4j
public class ChainHashCalculator {

    private static final int REQUIRED_DIGEST_BYTES = 32;

    private final CanonicalEncoder encoder;
    private final String hashAlgorithm;

    @Autowired
    public ChainHashCalculator(CanonicalEncoder encoder, LedgerProperties properties) {
        this(encoder, properties.getIntegrity().getHashAlgorithm());
    }

    public ChainHashCalculator(CanonicalEncoder encoder, String hashAlgorithm) {
        this.encoder = encoder;
        this.hashAlgorithm = hashAlgorithm;
        int length = newDigest().getDigestLength();
        if (length != REQUIRED_DIGEST_BYTES) {
            throw new LedgerConfigurationException(String.format(
                    "Hash algorithm %s yields %d bits, chain hashing requires 256", hashAlgorithm, length * 8));
        }
        log.info("Chain hashing configured with {}", hashAlgorithm);
    }

    public String computeHash(Prediction prediction, String previousHash) {
        return computeHash(ChainPayload.of(prediction, previousHash));
    }

    public String computeHash(ChainPayload payload) {
        return digestHex(encoder.encode(payload.toDocument()));
    }

    public String digestHex(String data) {
        return digestHex(data.getBytes(StandardCharsets.UTF_8));
    }

    public String digestHex(byte[] data) {
        return bytesToHex(newDigest().digest(data));
    }

    public CanonicalEncoder getEncoder() {
        return encoder;
    }

    private MessageDigest newDigest() {
        try {
            return MessageDigest.getInstance(hashAlgorithm);
        } catch (NoSuchAlgorithmException e) {
            throw new LedgerConfigurationException("Unsupported hash algorithm: " + hashAlgorithm, e);
        }
    }

    private static String bytesToHex(byte[] bytes) {
        StringBuilder result = new StringBuilder(bytes.length * 2);
        for (byte b : bytes) {
            result.append(String.format("%02x", b));
        }
        return result.toString();
    }
}
