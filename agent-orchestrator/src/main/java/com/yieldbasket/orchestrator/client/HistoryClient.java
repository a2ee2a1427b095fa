package com.yieldbasket.orchestrator.client;

import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.common.model.Decision;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Reads and writes against history-service. Reads fall back to an empty list so a
 * history outage degrades calibration rather than stalling the cycle.
 */
@Component
public class HistoryClient {

    private static final Logger log = LoggerFactory.getLogger(HistoryClient.class);

    private final WebClient historyClient;

    public HistoryClient(WebClient historyClient) {
        this.historyClient = historyClient;
    }

    public Mono<Decision> save(Decision decision) {
        return historyClient.post()
            .uri("/api/v1/decisions")
            .header("X-Trace-Id", decision.traceId())
            .bodyValue(decision)
            .retrieve()
            .bodyToMono(Decision.class);
    }

    public Mono<List<Decision>> recentDecisions(int limit) {
        return historyClient.get()
            .uri("/api/v1/decisions?limit={limit}", limit)
            .retrieve()
            .bodyToFlux(Decision.class)
            .collectList()
            .onErrorResume(e -> {
                log.warn("[History] Recent decisions fetch failed (non-critical). reason={}", e.getMessage());
                return Mono.just(List.of());
            });
    }

    public Mono<List<CalibrationHint>> calibrationHints(int limit) {
        return historyClient.get()
            .uri("/api/v1/calibration/hints?limit={limit}", limit)
            .retrieve()
            .bodyToFlux(CalibrationHint.class)
            .collectList()
            .onErrorResume(e -> {
                log.warn("[History] Calibration hints fetch failed (non-critical). reason={}", e.getMessage());
                return Mono.just(List.of());
            });
    }

    public Mono<CalibrationHint> reflect(String decisionId) {
        return historyClient.post()
            .uri("/api/v1/reflection/run/{decisionId}", decisionId)
            .retrieve()
            .bodyToMono(CalibrationHint.class);
    }
}
