package com.yieldbasket.staking.repository;

import com.yieldbasket.staking.model.RewardDepositRecord;
import org.springframework.data.r2dbc.repository.Query;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

import java.time.LocalDateTime;

@Repository
public interface RewardDepositRepository extends ReactiveCrudRepository<RewardDepositRecord, Long> {

    Mono<RewardDepositRecord> findByReference(String reference);

    @Query("""
        SELECT CAST(COALESCE(SUM(amount_raw), 0) AS BIGINT) FROM reward_deposit
        WHERE deposited_at >= :since
        """)
    Mono<Long> sumAmountSince(LocalDateTime since);
}
