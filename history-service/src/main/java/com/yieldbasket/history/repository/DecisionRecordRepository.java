package com.yieldbasket.history.repository;

import com.yieldbasket.history.model.DecisionRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface DecisionRecordRepository extends ReactiveCrudRepository<DecisionRecord, Long> {

    Mono<DecisionRecord> findByDecisionId(String decisionId);

    @Query("""
        SELECT * FROM decision_record
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<DecisionRecord> findLatest(int limit);

    /**
     * Decisions old enough to be scored that have not been reflected yet, oldest first.
     * SKIPPED decisions never ran the pipeline and are excluded.
     */
    @Query("""
        SELECT * FROM decision_record
        WHERE reflected = FALSE
          AND action <> 'SKIPPED'
          AND created_at <= :cutoff
        ORDER BY created_at ASC
        LIMIT :limit
        """)
    Flux<DecisionRecord> findUnreflectedBefore(LocalDateTime cutoff, int limit);
}
