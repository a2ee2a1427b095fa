package com.yieldbasket.staking.repository;

import com.yieldbasket.staking.model.StakeEntryRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface StakeEntryRepository extends ReactiveCrudRepository<StakeEntryRecord, Long> {

    Mono<StakeEntryRecord> findByOwner(String owner);

    Mono<Long> countByPrincipalGreaterThan(long principal);
}
