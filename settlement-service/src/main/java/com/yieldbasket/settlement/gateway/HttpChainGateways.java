package com.yieldbasket.settlement.gateway;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;
import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Live chain access through the chain gateway and the attestation service.
 * A 404 on a lookup means "not there yet" and maps to an empty result.
 */
@Configuration
@ConditionalOnProperty(name = "settlement.dry-run", havingValue = "false")
public class HttpChainGateways {

    record LockRequest(@JsonProperty("jobId") long jobId, @JsonProperty("amountRaw") long amountRaw) {}
    record LockResponse(@JsonProperty("lockRef") String lockRef) {}
    record ConfirmationResponse(@JsonProperty("confirmed") boolean confirmed,
                                @JsonProperty("messageHash") String messageHash) {}
    record FeesResponse(@JsonProperty("accumulatedRaw") long accumulatedRaw) {}
    record CongestionResponse(@JsonProperty("congestion") double congestion) {}
    record AttestationResponse(@JsonProperty("status") String status,
                               @JsonProperty("attestation") String attestation) {}
    record MintRequest(@JsonProperty("messageHash") String messageHash,
                       @JsonProperty("attestation") String attestation) {}
    record MintResponse(@JsonProperty("mintRef") String mintRef) {}

    private final Duration callTimeout;

    public HttpChainGateways(@Value("${settlement.gateway-timeout-ms:10000}") long callTimeoutMs) {
        this.callTimeout = Duration.ofMillis(callTimeoutMs);
    }

    @Bean
    public WebClient chainGatewayClient(WebClient.Builder builder,
                                        @Value("${services.chain-gateway.base-url}") String baseUrl) {
        return builder.clone().baseUrl(baseUrl).build();
    }

    @Bean
    public WebClient attestationClient(WebClient.Builder builder,
                                       @Value("${services.attestation.base-url}") String baseUrl) {
        return builder.clone().baseUrl(baseUrl).build();
    }

    @Bean
    public SourceChainGateway sourceChainGateway(WebClient chainGatewayClient) {
        return new SourceChainGateway() {
            @Override
            public Mono<String> findLock(long jobId) {
                return chainGatewayClient.get()
                    .uri("/api/v1/source/locks/by-job/{jobId}", jobId)
                    .retrieve()
                    .bodyToMono(LockResponse.class)
                    .map(LockResponse::lockRef)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                    .timeout(callTimeout);
            }

            @Override
            public Mono<String> submitLock(long jobId, long amountRaw) {
                return chainGatewayClient.post()
                    .uri("/api/v1/source/locks")
                    .bodyValue(new LockRequest(jobId, amountRaw))
                    .retrieve()
                    .bodyToMono(LockResponse.class)
                    .map(LockResponse::lockRef)
                    .timeout(callTimeout);
            }

            @Override
            public Mono<String> confirmation(String lockRef) {
                return chainGatewayClient.get()
                    .uri("/api/v1/source/locks/{lockRef}/confirmation", lockRef)
                    .retrieve()
                    .bodyToMono(ConfirmationResponse.class)
                    .filter(ConfirmationResponse::confirmed)
                    .map(ConfirmationResponse::messageHash)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                    .timeout(callTimeout);
            }

            @Override
            public Mono<Long> accumulatedFeesRaw() {
                return chainGatewayClient.get()
                    .uri("/api/v1/source/fees")
                    .retrieve()
                    .bodyToMono(FeesResponse.class)
                    .map(FeesResponse::accumulatedRaw)
                    .timeout(callTimeout);
            }

            @Override
            public Mono<Double> congestion() {
                return chainGatewayClient.get()
                    .uri("/api/v1/source/congestion")
                    .retrieve()
                    .bodyToMono(CongestionResponse.class)
                    .map(CongestionResponse::congestion)
                    .timeout(callTimeout);
            }
        };
    }

    @Bean
    public AttestationGateway attestationGateway(WebClient attestationClient) {
        return messageHash -> attestationClient.get()
            .uri("/v1/attestations/{messageHash}", messageHash)
            .retrieve()
            .bodyToMono(AttestationResponse.class)
            .filter(r -> "complete".equalsIgnoreCase(r.status()) && r.attestation() != null)
            .map(AttestationResponse::attestation)
            .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
            .timeout(callTimeout);
    }

    @Bean
    public DestinationChainGateway destinationChainGateway(WebClient chainGatewayClient) {
        return new DestinationChainGateway() {
            @Override
            public Mono<String> findMint(String messageHash) {
                return chainGatewayClient.get()
                    .uri("/api/v1/destination/mints/{messageHash}", messageHash)
                    .retrieve()
                    .bodyToMono(MintResponse.class)
                    .map(MintResponse::mintRef)
                    .onErrorResume(WebClientResponseException.NotFound.class, e -> Mono.empty())
                    .timeout(callTimeout);
            }

            @Override
            public Mono<String> submitMint(String messageHash, String attestation) {
                return chainGatewayClient.post()
                    .uri("/api/v1/destination/mints")
                    .bodyValue(new MintRequest(messageHash, attestation))
                    .retrieve()
                    .bodyToMono(MintResponse.class)
                    .map(MintResponse::mintRef)
                    .timeout(callTimeout);
            }
        };
    }
}
