package com.mediguard.ledger.repository;

import com.mediguard.ledger.domain.Prediction;
import org.springframework.data.domain.Slice;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

/**
 * Read access to stored predictions for chaining, verification and rebuild
 */
@Repository
public interface PredictionRepository extends JpaRepository<Prediction, String> {

    /**
     * Predictions in chain replay order: prediction timestamp, then creation time, then id
     */
    @Query("SELECT p FROM Prediction p ORDER BY p.timestamp ASC, p.createdAt ASC, p.id ASC")
    Slice<Prediction> findInReplayOrder(Pageable pageable);

    List<Prediction> findByIdIn(Collection<String> ids);
}
