package com.mediguard.ledger.repository;

import com.mediguard.ledger.domain.ChainEntry;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for hash chain persistence and queries
 */
@Repository
public interface ChainEntryRepository extends JpaRepository<ChainEntry, Long> {

    /**
     * Current chain head, the highest-sequence entry
     */
    Optional<ChainEntry> findFirstByOrderBySequenceDesc();

    boolean existsByPredictionId(String predictionId);

    Optional<ChainEntry> findByPredictionId(String predictionId);

    /**
     * Bounded ascending range scan, keyed on the last sequence already read
     */
    @Query("SELECT c FROM ChainEntry c WHERE c.sequence > :after AND c.sequence <= :upTo ORDER BY c.sequence ASC")
    List<ChainEntry> findRange(@Param("after") long after, @Param("upTo") long upTo, Pageable pageable);

    /**
     * Newest first, for chain listings
     */
    Page<ChainEntry> findAllByOrderBySequenceDesc(Pageable pageable);

    /**
     * Unanchored entries in causal order
     */
    List<ChainEntry> findByAnchorReferenceIsNullOrderBySequenceAsc(Pageable pageable);

    long countByAnchorReferenceIsNull();

    long countByAnchorReferenceIsNullAndSequenceLessThanEqual(long upTo);

    List<ChainEntry> findByAnchorReferenceOrderBySequenceAsc(String anchorReference);

    @Query("SELECT MAX(c.anchorPosition) FROM ChainEntry c")
    Optional<Long> findMaxAnchorPosition();

    /**
     * One-time anchor assignment for every still-unanchored entry up to the bound
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("UPDATE ChainEntry c SET c.anchorReference = :reference, c.anchorPosition = :position " +
           "WHERE c.anchorReference IS NULL AND c.sequence <= :upTo")
    int markAnchored(@Param("reference") String reference,
                     @Param("position") Long position,
                     @Param("upTo") long upTo);
}
