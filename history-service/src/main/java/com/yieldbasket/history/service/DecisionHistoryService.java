package com.yieldbasket.history.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.history.model.DecisionRecord;
import com.yieldbasket.history.repository.DecisionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.time.Clock;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Append-only decision log. A decision id is written once; a repeated save returns
 * the stored decision unchanged. Every new decision is also pushed to live subscribers.
 */
@Service
public class DecisionHistoryService {

    private static final Logger log = LoggerFactory.getLogger(DecisionHistoryService.class);

    static final int MAX_LIMIT = 500;

    private final DecisionRecordRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final Sinks.Many<Decision> decisionSink =
        Sinks.many().multicast().onBackpressureBuffer(64);

    public DecisionHistoryService(DecisionRecordRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository   = repository;
        this.objectMapper = objectMapper;
        this.clock        = clock;
    }

    public Mono<Decision> save(Decision decision) {
        return repository.findByDecisionId(decision.decisionId())
            .flatMap(existing -> {
                log.warn("[History] Decision already recorded, keeping the original. decisionId={} traceId={}",
                    decision.decisionId(), decision.traceId());
                return toDecision(existing);
            })
            .switchIfEmpty(Mono.defer(() -> Mono.fromCallable(() -> toRecord(decision))
                .flatMap(repository::save)
                .map(saved -> {
                    log.info("[History] Decision persisted. id={} decisionId={} action={} status={} traceId={}",
                        saved.getId(), saved.getDecisionId(), saved.getAction(), saved.getExecutionStatus(),
                        saved.getTraceId());
                    decisionSink.tryEmitNext(decision);
                    return decision;
                })))
            .doOnError(e -> log.error("[History] Failed to persist decision. decisionId={} traceId={}",
                decision.decisionId(), decision.traceId(), e));
    }

    /** Newest first. */
    public Mono<List<Decision>> latest(int limit) {
        int bounded = Math.max(1, Math.min(MAX_LIMIT, limit));
        return repository.findLatest(bounded)
            .concatMap(this::toDecision)
            .collectList();
    }

    public Mono<Decision> findById(String decisionId) {
        return repository.findByDecisionId(decisionId).flatMap(this::toDecision);
    }

    public Flux<Decision> stream() {
        return decisionSink.asFlux();
    }

    Mono<Decision> toDecision(DecisionRecord record) {
        return Mono.fromCallable(() -> objectMapper.readValue(record.getPayload(), Decision.class));
    }

    private DecisionRecord toRecord(Decision decision) throws Exception {
        DecisionRecord record = new DecisionRecord();
        record.setDecisionId(decision.decisionId());
        record.setTraceId(decision.traceId());
        record.setTriggerReason(decision.triggerReason() != null ? decision.triggerReason().name() : null);
        record.setAction(decision.action().name());
        record.setConfidence(decision.confidence());
        record.setExecutionStatus(decision.executionStatus().name());
        record.setTxReference(decision.txReference());
        record.setNavAtDecision(decision.navAtDecision());
        record.setPayload(objectMapper.writeValueAsString(decision));
        record.setReflected(false);
        record.setCreatedAt(LocalDateTime.ofInstant(decision.createdAt(), ZoneOffset.UTC));
        record.setSavedAt(LocalDateTime.now(clock));
        return record;
    }
}
