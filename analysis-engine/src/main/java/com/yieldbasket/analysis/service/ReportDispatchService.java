package com.yieldbasket.analysis.service;

import com.yieldbasket.analysis.producer.ReportProducer;
import com.yieldbasket.analysis.review.ModelReviewService;
import com.yieldbasket.common.exception.ProducerFailureException;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeoutException;

/**
 * Runs producers off the event loop under a time budget. Never emits an error:
 * a failing or late producer yields an error-marked {@link AnalystReport}.
 */
@Service
public class ReportDispatchService {

    private static final Logger log = LoggerFactory.getLogger(ReportDispatchService.class);

    private final Map<ProducerKind, ReportProducer> producers = new EnumMap<>(ProducerKind.class);
    private final ModelReviewService reviewService;
    private final Duration budget;

    public ReportDispatchService(List<ReportProducer> producers,
                                 ModelReviewService reviewService,
                                 @Value("${analysis.producer-budget-ms:6000}") long budgetMs) {
        producers.forEach(p -> this.producers.put(p.kind(), p));
        this.reviewService = reviewService;
        this.budget        = Duration.ofMillis(budgetMs);
    }

    public Mono<AnalystReport> dispatch(ProducerKind kind, ReportRequest request) {
        ReportProducer producer = producers.get(kind);
        if (producer == null) {
            return Mono.just(AnalystReport.failed(kind, "no producer registered for " + kind));
        }
        return Mono.fromCallable(() -> producer.produce(request))
            .subscribeOn(Schedulers.boundedElastic())
            .flatMap(baseline -> reviewService.review(baseline, request, budget))
            .timeout(budget)
            .doOnSuccess(r -> log.info("Producer={} complete. signal={} confidence={} traceId={}",
                kind, r.signal(), r.confidence(), request.traceId()))
            .onErrorResume(e -> {
                String reason = describe(e);
                log.error("Producer={} failed. reason={} traceId={}", kind, reason, request.traceId());
                return Mono.just(AnalystReport.failed(kind, reason));
            });
    }

    public Mono<List<AnalystReport>> dispatchAll(ReportRequest request) {
        log.info("Dispatching {} producers in parallel. traceId={}", producers.size(), request.traceId());
        return Flux.fromArray(ProducerKind.values())
            .flatMap(kind -> dispatch(kind, request))
            .collectList();
    }

    private String describe(Throwable e) {
        if (e instanceof TimeoutException) {
            return "timeout after " + budget.toMillis() + "ms";
        }
        if (e instanceof ProducerFailureException) {
            return e.getMessage();
        }
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
