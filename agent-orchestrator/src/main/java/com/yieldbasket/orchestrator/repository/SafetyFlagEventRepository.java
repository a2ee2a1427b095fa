package com.yieldbasket.orchestrator.repository;

import com.yieldbasket.orchestrator.model.SafetyFlagEvent;
import org.springframework.data.repository.reactive.ReactiveCrudRepository;
import org.springframework.stereotype.Repository;
import reactor.core.publisher.Mono;

@Repository
public interface SafetyFlagEventRepository extends ReactiveCrudRepository<SafetyFlagEvent, Long> {

    Mono<SafetyFlagEvent> findFirstByFlagOrderByIdDesc(String flag);
}
