package com.yieldbasket.common.llm;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * {@link CompletionClient} over the Anthropic Messages API.
 *
 * <p>Not a Spring bean on its own: each service builds one from its
 * {@code anthropic.*} properties so the library stays free of configuration wiring.
 */
public class AnthropicCompletionClient implements CompletionClient {

    private static final Logger log = LoggerFactory.getLogger(AnthropicCompletionClient.class);

    public static final String DEFAULT_BASE_URL = "https://api.anthropic.com";
    static final String API_VERSION = "2023-06-01";

    private final WebClient anthropicClient;
    private final ObjectMapper objectMapper;
    private final String apiKey;
    private final String model;
    private final int maxTokens;

    public AnthropicCompletionClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                     String baseUrl, String apiKey, String model, int maxTokens) {
        this.anthropicClient = builder
            .baseUrl(baseUrl)
            .defaultHeader("anthropic-version", API_VERSION)
            .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
            .build();
        this.objectMapper = objectMapper;
        this.apiKey       = apiKey;
        this.model        = model;
        this.maxTokens    = maxTokens;
    }

    @Override
    public boolean isEnabled() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public Mono<String> complete(String prompt, Duration timeout) {
        if (!isEnabled()) {
            return Mono.error(new IllegalStateException("completion client has no API key"));
        }
        Map<String, Object> requestBody = Map.of(
            "model", model,
            "max_tokens", maxTokens,
            "messages", List.of(Map.of("role", "user", "content", prompt))
        );

        return Mono.fromCallable(() -> objectMapper.writeValueAsString(requestBody))
            .flatMap(bodyJson ->
                anthropicClient.post()
                    .uri("/v1/messages")
                    .header("x-api-key", apiKey)
                    .bodyValue(bodyJson)
                    .retrieve()
                    .bodyToMono(String.class))
            .timeout(timeout)
            .map(this::extractText)
            .doOnError(e -> log.warn("[Completion] call failed. model={} reason={}", model, e.toString()));
    }

    private String extractText(String response) {
        try {
            JsonNode root = objectMapper.readTree(response);
            JsonNode first = root.path("content").path(0);
            if (!first.hasNonNull("text")) {
                throw new IllegalStateException("completion response has no text content");
            }
            return first.path("text").asText();
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            throw new IllegalStateException("failed to read completion response", e);
        }
    }
}
