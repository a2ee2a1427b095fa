package com.yieldbasket.settlement.repository;

import com.yieldbasket.settlement.model.BridgeEvent;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Flux;

@Repository
public interface BridgeEventRepository extends ReactiveCrudRepository<BridgeEvent, Long> {

    Flux<BridgeEvent> findByJobIdOrderByIdAsc(Long jobId);
}
