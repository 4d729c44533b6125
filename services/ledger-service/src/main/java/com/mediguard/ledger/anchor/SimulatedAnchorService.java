package com.mediguard.ledger.anchor;

import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.integrity.CanonicalEncoder;
import com.mediguard.ledger.integrity.ChainHashCalculator;
import com.mediguard.ledger.repository.ChainEntryRepository;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Local stand-in for a distributed ledger, used when none is configured.
 *
 * <p>References are derived from the head hash, the commit time and the metadata
 * with the chain's own hash function; positions come from a local counter that
 * continues after the highest position already stored.
 */
@Slf4j
public class SimulatedAnchorService implements AnchorService {

    public static final String MODE = "simulated";

    private static final int REFERENCE_HEX_LENGTH = 16;

    private final ChainHashCalculator hashCalculator;
    private final ChainEntryRepository chainEntryRepository;
    private final Clock clock;
    private final String applicationTag;
    private final AtomicLong position;
    private final Map<String, AnchorVerification> issued = new ConcurrentHashMap<>();

    public SimulatedAnchorService(ChainHashCalculator hashCalculator,
                                  ChainEntryRepository chainEntryRepository,
                                  Clock clock,
                                  String applicationTag) {
        this.hashCalculator = hashCalculator;
        this.chainEntryRepository = chainEntryRepository;
        this.clock = clock;
        this.applicationTag = applicationTag;
        this.position = new AtomicLong(chainEntryRepository.findMaxAnchorPosition().orElse(0L));
        log.info("Simulated anchor service starting at position {}", position.get());
    }

    @Override
    public AnchorReceipt commit(String headHash, Map<String, Object> metadata) {
        String timestamp = CanonicalEncoder.formatTimestamp(Instant.now(clock));
        StringBuilder data = new StringBuilder()
                .append(applicationTag).append(':')
                .append(headHash).append(':')
                .append(timestamp);
        if (metadata != null && !metadata.isEmpty()) {
            data.append(':').append(hashCalculator.getEncoder().encodeToString(metadata));
        }

        String reference = "0x" + hashCalculator.digestHex(data.toString()).substring(0, REFERENCE_HEX_LENGTH);
        long assigned = position.incrementAndGet();

        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("head_hash", headHash);
        raw.put("timestamp", timestamp);
        raw.put("block_number", assigned);
        raw.put("gas_used", 0);
        raw.put("status", 1);
        if (metadata != null) {
            raw.put("metadata", metadata);
        }

        issued.put(reference, AnchorVerification.builder()
                .reference(reference)
                .found(true)
                .position(assigned)
                .mode(MODE)
                .rawData(raw)
                .build());

        log.info("Simulated anchor commit of head {} as {} at position {}", headHash, reference, assigned);
        return AnchorReceipt.builder()
                .reference(reference)
                .position(assigned)
                .mode(MODE)
                .raw(raw)
                .build();
    }

    @Override
    public AnchorVerification verify(String reference) {
        AnchorVerification known = issued.get(reference);
        if (known != null) {
            return known;
        }

        // Receipts issued before a restart are only known through the entries carrying them
        List<ChainEntry> anchored = chainEntryRepository.findByAnchorReferenceOrderBySequenceAsc(reference);
        if (anchored.isEmpty()) {
            return AnchorVerification.notFound(reference, MODE);
        }
        ChainEntry last = anchored.get(anchored.size() - 1);
        Map<String, Object> raw = new LinkedHashMap<>();
        raw.put("head_hash", last.getCurrentHash());
        raw.put("block_number", last.getAnchorPosition());
        raw.put("status", 1);
        return AnchorVerification.builder()
                .reference(reference)
                .found(true)
                .position(last.getAnchorPosition())
                .mode(MODE)
                .rawData(raw)
                .build();
    }

    @Override
    public String mode() {
        return MODE;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }
}
