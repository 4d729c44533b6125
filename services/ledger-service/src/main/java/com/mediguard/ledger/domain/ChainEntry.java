package com.mediguard.ledger.domain;

import jakarta.persistence.*;
import lombok.*;
import org.springframework.data.domain.Persistable;

import java.time.Instant;

/**
 * One link of the prediction hash chain.
 *
 * <p>The sequence is assigned by the ledger as head + 1 (0 for genesis) and is never
 * generated by the database, so two appends that read the same head collide on the
 * primary key instead of silently forking the chain. Entries are always inserted,
 * never merged; only the anchor columns change after insert, once.
 */
@Entity
@Table(name = "hash_chain",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_hash_chain_prediction_id", columnNames = "prediction_id"),
                @UniqueConstraint(name = "uk_hash_chain_current_hash", columnNames = "current_hash"),
                @UniqueConstraint(name = "uk_hash_chain_previous_hash", columnNames = "previous_hash")
        },
        indexes = {
                @Index(name = "idx_hash_chain_anchor_reference", columnList = "anchor_reference")
        })
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChainEntry implements Persistable<Long> {

    @Id
    @Column(name = "sequence", nullable = false, updatable = false)
    private Long sequence;

    @Column(name = "prediction_id", nullable = false, updatable = false)
    private String predictionId;

    @Column(name = "previous_hash", length = 128, updatable = false)
    private String previousHash;

    @Column(name = "current_hash", nullable = false, length = 128, updatable = false)
    private String currentHash;

    @Column(name = "entry_timestamp", nullable = false, updatable = false)
    private Instant entryTimestamp;

    @Column(name = "anchor_reference", length = 128)
    private String anchorReference;

    @Column(name = "anchor_position")
    private Long anchorPosition;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Transient
    private boolean persisted;

    @Override
    public Long getId() {
        return sequence;
    }

    @Override
    public boolean isNew() {
        return !persisted;
    }

    public boolean isAnchored() {
        return anchorReference != null;
    }

    public boolean isGenesis() {
        return sequence != null && sequence == 0L;
    }

    @PrePersist
    protected void onCreate() {
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @PostPersist
    @PostLoad
    protected void markPersisted() {
        persisted = true;
    }
}
