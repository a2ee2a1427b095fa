package com.yieldbasket.history.repository;

import com.yieldbasket.history.model.CalibrationHintRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@Repository
public interface CalibrationHintRepository extends ReactiveCrudRepository<CalibrationHintRecord, Long> {

    Mono<CalibrationHintRecord> findFirstByDecisionId(String decisionId);

    @Query("""
        SELECT * FROM calibration_hint
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<CalibrationHintRecord> findLatest(int limit);
}
