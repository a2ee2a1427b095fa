package com.yieldbasket.scheduler.client;

import com.yieldbasket.common.model.CycleTriggerEvent;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.scheduler.config.SchedulerProperties;
import com.yieldbasket.scheduler.model.CycleOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.UUID;

/**
 * Triggers decision cycles on agent-orchestrator.
 *
 * <p>Never errors: a 409 becomes {@link CycleOutcome.Status#BUSY} and any other failure,
 * including the call timeout, becomes {@link CycleOutcome.Status#FAILED}.
 */
@Component
public class OrchestratorClient {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorClient.class);

    private final WebClient           orchestratorClient;
    private final SchedulerProperties properties;

    public OrchestratorClient(WebClient orchestratorClient, SchedulerProperties properties) {
        this.orchestratorClient = orchestratorClient;
        this.properties         = properties;
    }

    public Mono<CycleOutcome> triggerCycle(TriggerReason reason) {
        return Mono.defer(() -> {
            String traceId = UUID.randomUUID().toString();
            CycleTriggerEvent event = new CycleTriggerEvent(reason, Instant.now(), traceId);
            log.info("[Cycle] triggering reason={} traceId={}", reason, traceId);

            return orchestratorClient.post()
                .uri("/api/v1/orchestrate/trigger")
                .header("X-Trace-Id", traceId)
                .bodyValue(event)
                .retrieve()
                .bodyToMono(Decision.class)
                .timeout(properties.cycleTimeout())
                .map(CycleOutcome::completed)
                .doOnNext(o -> log.info("[Cycle] completed traceId={} action={} execution={}",
                                        traceId, o.decision().action(), o.decision().executionStatus()))
                .onErrorResume(WebClientResponseException.Conflict.class, e -> {
                    log.info("[Cycle] orchestrator busy, skipping this tick. traceId={}", traceId);
                    return Mono.just(CycleOutcome.busy());
                })
                .onErrorResume(e -> {
                    log.error("[Cycle] orchestrator call failed. traceId={} reason={}", traceId, e.toString());
                    return Mono.just(CycleOutcome.failed(e.getClass().getSimpleName() + ": " + e.getMessage()));
                })
                .defaultIfEmpty(CycleOutcome.failed("empty response"));
        });
    }
}
