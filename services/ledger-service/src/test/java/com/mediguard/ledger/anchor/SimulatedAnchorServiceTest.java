package com.mediguard.ledger.anchor;

import com.mediguard.ledger.domain.ChainEntry;
import com.mediguard.ledger.integrity.CanonicalEncoder;
import com.mediguard.ledger.integrity.ChainHashCalculator;
import com.mediguard.ledger.repository.ChainEntryRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
@DisplayName("Simulated Anchor Service Tests")
class SimulatedAnchorServiceTest {

    private static final String HEAD = "9f86d081884c7d659a2feaa0c55ad015a3bf4f1b2b0b822cd15d6c15b0f00a08";
    private static final Instant NOW = Instant.parse("2024-06-01T12:00:00Z");

    @Mock
    private ChainEntryRepository chainEntryRepository;

    private ChainHashCalculator hashCalculator;
    private Clock clock;

    @BeforeEach
    void setUp() {
        hashCalculator = new ChainHashCalculator(new CanonicalEncoder(), "SHA-256");
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
    }

    @Test
    @DisplayName("Should derive the reference from tag, head, timestamp and canonical metadata")
    void shouldDeriveReferenceDeterministically() {
        when(chainEntryRepository.findMaxAnchorPosition()).thenReturn(Optional.empty());
        SimulatedAnchorService service = new SimulatedAnchorService(hashCalculator, chainEntryRepository, clock, "MediGuardAI");
        Map<String, Object> metadata = Map.of("total_entries", 3L);

        AnchorReceipt receipt = service.commit(HEAD, metadata);

        String expected = "0x" + hashCalculator.digestHex("MediGuardAI:" + HEAD + ":2024-06-01T12:00:00.000000Z:"
                + "{\"total_entries\":3}").substring(0, 16);
        assertThat(receipt.getReference()).isEqualTo(expected).hasSize(18);
        assertThat(receipt.getMode()).isEqualTo("simulated");
        assertThat(receipt.getPosition()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Should continue positions after the highest stored anchor position")
    void shouldSeedPositionFromStore() {
        when(chainEntryRepository.findMaxAnchorPosition()).thenReturn(Optional.of(41L));
        SimulatedAnchorService service = new SimulatedAnchorService(hashCalculator, chainEntryRepository, clock, "MediGuardAI");

        assertThat(service.commit(HEAD, Map.of()).getPosition()).isEqualTo(42L);
        assertThat(service.commit(HEAD + "0", Map.of()).getPosition()).isEqualTo(43L);
    }

    @Test
    @DisplayName("Should find receipts it issued and report unknown references as not found")
    void shouldVerifyIssuedReceipts() {
        when(chainEntryRepository.findMaxAnchorPosition()).thenReturn(Optional.empty());
        when(chainEntryRepository.findByAnchorReferenceOrderBySequenceAsc("0xunknown")).thenReturn(List.of());
        SimulatedAnchorService service = new SimulatedAnchorService(hashCalculator, chainEntryRepository, clock, "MediGuardAI");
        AnchorReceipt receipt = service.commit(HEAD, Map.of("total_entries", 1L));

        AnchorVerification found = service.verify(receipt.getReference());
        AnchorVerification missing = service.verify("0xunknown");

        assertThat(found.isFound()).isTrue();
        assertThat(found.getPosition()).isEqualTo(receipt.getPosition());
        assertThat(found.getRawData()).containsEntry("head_hash", HEAD);
        assertThat(missing.isFound()).isFalse();
    }

    @Test
    @DisplayName("Should answer for references issued before a restart from the stored entries")
    void shouldVerifyFromStoredEntries() {
        when(chainEntryRepository.findMaxAnchorPosition()).thenReturn(Optional.of(7L));
        ChainEntry anchored = ChainEntry.builder()
                .sequence(4L)
                .predictionId("p4")
                .currentHash(HEAD)
                .anchorReference("0xabcdef0123456789")
                .anchorPosition(7L)
                .build();
        when(chainEntryRepository.findByAnchorReferenceOrderBySequenceAsc("0xabcdef0123456789"))
                .thenReturn(List.of(anchored));
        SimulatedAnchorService service = new SimulatedAnchorService(hashCalculator, chainEntryRepository, clock, "MediGuardAI");

        AnchorVerification verification = service.verify("0xabcdef0123456789");

        assertThat(verification.isFound()).isTrue();
        assertThat(verification.getPosition()).isEqualTo(7L);
        assertThat(service.isAvailable()).isTrue();
    }
}
