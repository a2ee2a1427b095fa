package com.yieldbasket.orchestrator.client;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Map;

/**
 * On-chain basket contract gateway. The contract deduplicates by {@code decisionId},
 * so a resubmitted decision returns the original transaction reference.
 */
@Component
public class BasketContractClient {

    public record RebalanceRequest(@JsonProperty("decisionId") String decisionId,
                                   @JsonProperty("weights") Map<String, Double> weights) {}

    public record Submission(@JsonProperty("txReference") String txReference) {}

    private final WebClient basketContractClient;

    public BasketContractClient(WebClient basketContractClient) {
        this.basketContractClient = basketContractClient;
    }

    public Mono<String> submitRebalance(String decisionId, Map<String, Double> weights, String traceId) {
        return basketContractClient.post()
            .uri("/api/v1/basket/rebalance")
            .header("X-Trace-Id", traceId)
            .bodyValue(new RebalanceRequest(decisionId, weights))
            .retrieve()
            .bodyToMono(Submission.class)
            .map(Submission::txReference);
    }

    public Mono<String> submitEmergencyExit(String decisionId, String traceId) {
        return basketContractClient.post()
            .uri("/api/v1/basket/emergency-exit")
            .header("X-Trace-Id", traceId)
            .bodyValue(new RebalanceRequest(decisionId, Map.of()))
            .retrieve()
            .bodyToMono(Submission.class)
            .map(Submission::txReference);
    }
}
