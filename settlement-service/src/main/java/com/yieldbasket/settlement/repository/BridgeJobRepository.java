package com.yieldbasket.settlement.repository;

import com.yieldbasket.settlement.model.BridgeJob;
import com.yieldbasket.settlement.model.BridgeState;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;
import java.util.Collection;

@Repository
public interface BridgeJobRepository extends ReactiveCrudRepository<BridgeJob, Long> {

    /** Jobs not yet in one of the given states, oldest first. */
    Flux<BridgeJob> findByStateNotInOrderByCreatedAtAsc(Collection<BridgeState> states);

    @Query("""
        SELECT * FROM bridge_job
        ORDER BY created_at DESC
        LIMIT :limit
        """)
    Flux<BridgeJob> findLatest(int limit);

    @Query("""
        SELECT * FROM bridge_job
        ORDER BY created_at DESC
        LIMIT 1
        """)
    Mono<BridgeJob> findMostRecent();

    /** Value of every job created since the given instant that was not cancelled. */
    @Query("""
        SELECT COALESCE(SUM(amount_raw), 0) FROM bridge_job
        WHERE state <> 'CANCELLED' AND created_at >= :since
        """)
    Mono<Long> sumAmountCreatedSince(LocalDateTime since);
}
