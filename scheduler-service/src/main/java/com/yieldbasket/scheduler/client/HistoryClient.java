package com.yieldbasket.scheduler.client;

import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.scheduler.config.SchedulerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.ParameterizedTypeReference;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.List;

/**
 * Runs the reflection sweep on history-service.
 *
 * <p>All errors are absorbed with an empty {@link Mono} so the reflection loop never stalls
 * if history-service is unreachable.
 */
@Component
public class HistoryClient {

    private static final Logger log = LoggerFactory.getLogger(HistoryClient.class);

    private static final ParameterizedTypeReference<List<CalibrationHint>> HINTS =
        new ParameterizedTypeReference<>() {};

    private final WebClient           historyClient;
    private final SchedulerProperties properties;

    public HistoryClient(WebClient historyClient, SchedulerProperties properties) {
        this.historyClient = historyClient;
        this.properties    = properties;
    }

    /** @return number of hints produced by the sweep; empty when the call failed */
    public Mono<Integer> runReflectionSweep() {
        return historyClient.post()
            .uri("/api/v1/reflection/run")
            .retrieve()
            .bodyToMono(HINTS)
            .timeout(properties.reflectionTimeout())
            .map(List::size)
            .defaultIfEmpty(0)
            .onErrorResume(e -> {
                log.warn("[Reflection] sweep call failed, will retry next tick. reason={}", e.toString());
                return Mono.empty();
            });
    }
}
