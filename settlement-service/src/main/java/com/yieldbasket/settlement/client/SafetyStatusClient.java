package com.yieldbasket.settlement.client;

import com.yieldbasket.common.safety.SafetyStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Reads the orchestrator's kill-switch and loss-halt flags. Fails closed: an unreachable
 * orchestrator reads as an engaged kill switch.
 */
@Component
public class SafetyStatusClient {

    private static final Logger log = LoggerFactory.getLogger(SafetyStatusClient.class);

    private final WebClient orchestratorClient;
    private final Duration timeout;

    public SafetyStatusClient(WebClient orchestratorClient,
                              @Value("${settlement.safety-timeout-ms:5000}") long timeoutMs) {
        this.orchestratorClient = orchestratorClient;
        this.timeout            = Duration.ofMillis(timeoutMs);
    }

    public Mono<SafetyStatus> current() {
        return orchestratorClient.get()
            .uri("/api/v1/safety/status")
            .retrieve()
            .bodyToMono(SafetyStatus.class)
            .timeout(timeout)
            .onErrorResume(e -> {
                log.warn("[Safety] Status unreachable, treating as halted. reason={}", e.toString());
                return Mono.just(SafetyStatus.unreachable(e.getClass().getSimpleName()));
            });
    }
}
