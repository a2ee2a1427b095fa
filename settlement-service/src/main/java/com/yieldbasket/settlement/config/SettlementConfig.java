package com.yieldbasket.settlement.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.common.safety.TransferLimiter;
import com.yieldbasket.settlement.trigger.TriggerPolicy;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class SettlementConfig {

    @Value("${services.orchestrator.base-url}")
    private String orchestratorUrl;

    @Value("${services.staking.base-url}")
    private String stakingUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Bean
    public WebClient orchestratorClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(orchestratorUrl).build();
    }

    @Bean
    public WebClient stakingClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(stakingUrl).build();
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(notificationUrl).build();
    }

    // ── guards and policy ───────────────────────────────────────────────────

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public IdempotencyGuard idempotencyGuard(Clock clock) {
        return new IdempotencyGuard(clock);
    }

    @Bean
    public TransferLimiter transferLimiter(Clock clock,
                                           @Value("${settlement.limits.per-job-raw:50000000000}") long perJobRaw,
                                           @Value("${settlement.limits.rolling-raw:100000000000}") long rollingRaw,
                                           @Value("${settlement.limits.window:PT24H}") Duration window) {
        return new TransferLimiter(clock, perJobRaw, rollingRaw, window);
    }

    @Bean
    public TriggerPolicy triggerPolicy(@Value("${settlement.trigger.threshold-raw:1000000000}") long thresholdRaw,
                                       @Value("${settlement.trigger.fallback-interval:P7D}") Duration fallbackInterval,
                                       @Value("${settlement.congestion-ceiling:0.8}") double congestionCeiling) {
        return new TriggerPolicy(thresholdRaw, fallbackInterval, congestionCeiling);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }
}
