package com.yieldbasket.staking.repository;

import com.yieldbasket.staking.model.StakePoolRecord;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface StakePoolRepository extends ReactiveCrudRepository<StakePoolRecord, Long> {
}
