package com.yieldbasket.orchestrator.fanout;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import com.yieldbasket.orchestrator.client.ReportProducerClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.Comparator;
import java.util.concurrent.TimeoutException;

/**
 * Calls all four producers concurrently and waits for every one of them.
 * A producer that errors or misses its deadline is replaced by an error-marked report.
 */
@Service
public class ReportFanOutService {

    private static final Logger log = LoggerFactory.getLogger(ReportFanOutService.class);

    private final ReportProducerClient producerClient;
    private final Duration producerTimeout;

    public ReportFanOutService(ReportProducerClient producerClient,
                               @Value("${orchestrator.producer-timeout-ms:8000}") long producerTimeoutMs) {
        this.producerClient  = producerClient;
        this.producerTimeout = Duration.ofMillis(producerTimeoutMs);
    }

    public Mono<FanOutResult> gather(ReportRequest request) {
        return Flux.fromArray(ProducerKind.values())
            .flatMap(kind -> fetch(kind, request))
            .sort(Comparator.comparing(AnalystReport::producer))
            .collectList()
            .map(FanOutResult::new)
            .doOnNext(r -> log.info("[FanOut] Reports gathered. failed={} of {} traceId={}",
                r.failedCount(), r.reports().size(), request.traceId()));
    }

    private Mono<AnalystReport> fetch(ProducerKind kind, ReportRequest request) {
        return producerClient.produce(kind, request)
            .timeout(producerTimeout)
            .switchIfEmpty(Mono.fromSupplier(() -> AnalystReport.failed(kind, "empty response")))
            .onErrorResume(e -> {
                String reason = e instanceof TimeoutException
                    ? "timeout after " + producerTimeout.toMillis() + "ms"
                    : e.getClass().getSimpleName() + ": " + e.getMessage();
                log.warn("[FanOut] Producer failed. producer={} reason={} traceId={}", kind, reason, request.traceId());
                return Mono.just(AnalystReport.failed(kind, reason));
            });
    }
}
