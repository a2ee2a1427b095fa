package com.yieldbasket.history.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.reflection.ReflectionResult;
import com.yieldbasket.common.reflection.ReflectionScorer;
import com.yieldbasket.history.client.PortfolioSnapshotClient;
import com.yieldbasket.history.exception.DecisionNotFoundException;
import com.yieldbasket.history.exception.ReflectionRejectedException;
import com.yieldbasket.history.model.CalibrationHintRecord;
import com.yieldbasket.history.model.DecisionRecord;
import com.yieldbasket.history.repository.CalibrationHintRepository;
import com.yieldbasket.history.repository.DecisionRecordRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.reactive.TransactionalOperator;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

/**
 * Reflection Engine. Scores decisions that are at least {@code reflection.min-age} old against
 * the realized basket state and appends one {@link CalibrationHint} per decision.
 *
 * <p>Reads history and the current snapshot only; it never touches live trading state.
 * Reflecting an already reflected decision returns the stored hint. The hint insert and the
 * decision's reflected flag commit together, so a failed attempt can simply be repeated.
 */
@Service
public class ReflectionService {

    private static final Logger log = LoggerFactory.getLogger(ReflectionService.class);

    private static final TypeReference<Map<ProducerKind, Double>> ACCURACY_TYPE = new TypeReference<>() {};

    static final int MAX_HINTS = 200;

    private final DecisionRecordRepository decisionRepository;
    private final CalibrationHintRepository hintRepository;
    private final DecisionHistoryService historyService;
    private final PortfolioSnapshotClient snapshotClient;
    private final ObjectMapper objectMapper;
    private final TransactionalOperator transactionalOperator;
    private final Clock clock;
    private final Duration minAge;
    private final int batchSize;

    public ReflectionService(DecisionRecordRepository decisionRepository,
                             CalibrationHintRepository hintRepository,
                             DecisionHistoryService historyService,
                             PortfolioSnapshotClient snapshotClient,
                             ObjectMapper objectMapper,
                             TransactionalOperator transactionalOperator,
                             Clock clock,
                             @Value("${reflection.min-age:PT24H}") Duration minAge,
                             @Value("${reflection.batch-size:50}") int batchSize) {
        this.decisionRepository    = decisionRepository;
        this.hintRepository        = hintRepository;
        this.historyService        = historyService;
        this.snapshotClient        = snapshotClient;
        this.objectMapper          = objectMapper;
        this.transactionalOperator = transactionalOperator;
        this.clock                 = clock;
        this.minAge                = minAge;
        this.batchSize             = batchSize;
    }

    public Mono<CalibrationHint> reflect(String decisionId) {
        return decisionRepository.findByDecisionId(decisionId)
            .switchIfEmpty(Mono.error(() -> new DecisionNotFoundException(decisionId)))
            .flatMap(this::reflectRecord);
    }

    /** Reflects every due decision, oldest first. One failing decision does not stop the sweep. */
    public Mono<List<CalibrationHint>> sweep() {
        LocalDateTime cutoff = LocalDateTime.now(clock).minus(minAge);
        return decisionRepository.findUnreflectedBefore(cutoff, batchSize)
            .concatMap(record -> reflectRecord(record)
                .onErrorResume(e -> {
                    log.warn("[Reflection] Decision skipped in sweep. decisionId={} reason={}",
                        record.getDecisionId(), e.getMessage());
                    return Mono.empty();
                }))
            .collectList()
            .doOnNext(hints -> log.info("[Reflection] Sweep complete. reflected={} cutoff={}", hints.size(), cutoff));
    }

    public Mono<List<CalibrationHint>> latestHints(int limit) {
        int bounded = Math.max(1, Math.min(MAX_HINTS, limit));
        return hintRepository.findLatest(bounded)
            .concatMap(this::toHint)
            .collectList();
    }

    // ── scoring ─────────────────────────────────────────────────────────────

    private Mono<CalibrationHint> reflectRecord(DecisionRecord record) {
        if (Boolean.TRUE.equals(record.getReflected())) {
            return hintRepository.findFirstByDecisionId(record.getDecisionId()).flatMap(this::toHint);
        }
        if (DecisionAction.SKIPPED.name().equals(record.getAction())) {
            return Mono.error(new ReflectionRejectedException(
                "decision " + record.getDecisionId() + " was skipped by a safety halt and has nothing to score"));
        }
        LocalDateTime dueAt = record.getCreatedAt().plus(minAge);
        if (dueAt.isAfter(LocalDateTime.now(clock))) {
            return Mono.error(new ReflectionRejectedException(
                "decision " + record.getDecisionId() + " is not due for reflection until " + dueAt));
        }

        return historyService.toDecision(record)
            .zipWith(snapshotClient.current())
            .flatMap(pair -> {
                Decision decision = pair.getT1();
                ReflectionResult result = ReflectionScorer.score(decision,
                    pair.getT2().navUsd(), pair.getT2().latestPrices());
                Mono<CalibrationHintRecord> writes = Mono.fromCallable(() -> toRecord(decision.decisionId(), result))
                    .flatMap(hintRepository::save)
                    .flatMap(savedHint -> {
                        record.setReflected(true);
                        return decisionRepository.save(record).thenReturn(savedHint);
                    });
                return transactionalOperator.transactional(writes)
                    .doOnError(e -> record.setReflected(false))
                    .flatMap(this::toHint)
                    .doOnNext(hint -> log.info("[Reflection] Decision reflected. decisionId={} navChange={} note={}",
                        hint.decisionId(), hint.realizedNavChange(), hint.note()));
            });
    }

    private CalibrationHintRecord toRecord(String decisionId, ReflectionResult result) throws Exception {
        CalibrationHintRecord hint = new CalibrationHintRecord();
        hint.setDecisionId(decisionId);
        hint.setProducerAccuracy(objectMapper.writeValueAsString(result.producerAccuracy()));
        hint.setRealizedNavChange(result.realizedNavChange());
        hint.setDecisionEdge(result.decisionEdge());
        hint.setBestProducer(result.bestProducer() != null ? result.bestProducer().name() : null);
        hint.setWorstProducer(result.worstProducer() != null ? result.worstProducer().name() : null);
        hint.setNote(result.note());
        hint.setCreatedAt(LocalDateTime.now(clock));
        return hint;
    }

    private Mono<CalibrationHint> toHint(CalibrationHintRecord record) {
        return Mono.fromCallable(() -> new CalibrationHint(
            record.getDecisionId(),
            objectMapper.readValue(record.getProducerAccuracy(), ACCURACY_TYPE),
            record.getRealizedNavChange(),
            record.getNote(),
            record.getCreatedAt().toInstant(ZoneOffset.UTC)));
    }
}
