package com.yieldbasket.scheduler.client;

import com.yieldbasket.scheduler.config.SchedulerProperties;
import com.yieldbasket.scheduler.model.SettlementSweep;
import com.yieldbasket.scheduler.model.StepSummary;
import com.yieldbasket.scheduler.model.TriggerSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;

/**
 * Drives settlement-service: evaluate the bridge trigger, then advance every pending job.
 *
 * <p>The pending sweep still runs when trigger evaluation fails, so in-flight jobs keep
 * moving. The sweep is marked unreachable only when the advance call itself fails.
 */
@Component
public class SettlementClient {

    private static final Logger log = LoggerFactory.getLogger(SettlementClient.class);

    private static final Duration TRIGGER_TIMEOUT = Duration.ofSeconds(30);

    private final WebClient           settlementClient;
    private final SchedulerProperties properties;

    public SettlementClient(WebClient settlementClient, SchedulerProperties properties) {
        this.settlementClient = settlementClient;
        this.properties       = properties;
    }

    public Mono<SettlementSweep> sweep() {
        return evaluateTrigger()
            .flatMap(trigger -> advancePending()
                .map(steps -> new SettlementSweep(trigger, steps, true))
                .onErrorResume(e -> {
                    log.warn("[Settlement] pending sweep failed. reason={}", e.toString());
                    return Mono.just(new SettlementSweep(trigger, List.of(), false));
                }));
    }

    Mono<TriggerSummary> evaluateTrigger() {
        return settlementClient.post()
            .uri("/api/v1/bridge/trigger/evaluate")
            .retrieve()
            .bodyToMono(TriggerSummary.class)
            .timeout(TRIGGER_TIMEOUT)
            .defaultIfEmpty(TriggerSummary.unavailable("empty response"))
            .onErrorResume(e -> {
                log.warn("[Settlement] trigger evaluation failed (non-critical). reason={}", e.toString());
                return Mono.just(TriggerSummary.unavailable(e.getClass().getSimpleName()));
            });
    }

    /** Advancing may wait out an attestation poll, hence the long bound. */
    Mono<List<StepSummary>> advancePending() {
        return settlementClient.post()
            .uri("/api/v1/bridge/jobs/advance-pending")
            .retrieve()
            .bodyToFlux(StepSummary.class)
            .collectList()
            .timeout(properties.settlementTimeout());
    }
}
