package com.yieldbasket.orchestrator.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.yieldbasket.common.llm.AnthropicCompletionClient;
import com.yieldbasket.common.llm.CompletionClient;
import com.yieldbasket.common.risk.RebalanceFrequencyJudge;
import com.yieldbasket.common.risk.RiskGate;
import com.yieldbasket.common.risk.RiskLimits;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.common.safety.KillSwitch;
import com.yieldbasket.common.safety.LossHaltGuard;
import com.yieldbasket.common.safety.PortfolioGuard;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.Clock;
import java.time.Duration;

@Configuration
public class OrchestratorConfig {

    @Value("${services.analysis-engine.base-url}")
    private String analysisEngineUrl;

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${services.notification.base-url}")
    private String notificationUrl;

    @Value("${services.portfolio-reader.base-url}")
    private String portfolioReaderUrl;

    @Value("${services.basket-contract.base-url}")
    private String basketContractUrl;

    @Bean
    public WebClient analysisEngineClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(analysisEngineUrl).build();
    }

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(historyUrl).build();
    }

    @Bean
    public WebClient notificationClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(notificationUrl).build();
    }

    @Bean
    public WebClient portfolioReaderClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(portfolioReaderUrl).build();
    }

    @Bean
    public WebClient basketContractClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(basketContractUrl).build();
    }

    @Bean
    public CompletionClient completionClient(WebClient.Builder builder, ObjectMapper objectMapper,
                                             @Value("${anthropic.base-url:" + AnthropicCompletionClient.DEFAULT_BASE_URL + "}") String baseUrl,
                                             @Value("${anthropic.api-key:}") String apiKey,
                                             @Value("${anthropic.model:claude-3-5-sonnet-latest}") String model,
                                             @Value("${anthropic.max-tokens:800}") int maxTokens) {
        return new AnthropicCompletionClient(builder.clone(), objectMapper, baseUrl, apiKey, model, maxTokens);
    }

    // ── risk and safety ─────────────────────────────────────────────────────

    @Bean
    public RiskLimits riskLimits(@Value("${risk.max-token-weight:0.30}") double maxTokenWeight,
                                 @Value("${risk.anchor-token:USDC}") String anchorToken,
                                 @Value("${risk.anchor-floor:0.05}") double anchorFloor,
                                 @Value("${risk.max-aggregate-change:0.25}") double maxAggregateChange,
                                 @Value("${risk.max-token-churn:2}") int maxTokenChurn,
                                 @Value("${risk.min-liquidity-usd:250000}") double minLiquidityUsd,
                                 @Value("${risk.non-trivial-weight:0.01}") double nonTrivialWeight,
                                 @Value("${risk.rolling-change-ceiling:0.50}") double rollingChangeCeiling,
                                 @Value("${risk.max-rebalances-per-day:3}") int maxRebalancesPerDay,
                                 @Value("${risk.small-basket-nav-usd:50000}") double smallBasketNavUsd) {
        return new RiskLimits(maxTokenWeight, anchorToken, anchorFloor, maxAggregateChange, maxTokenChurn,
            minLiquidityUsd, nonTrivialWeight, rollingChangeCeiling, maxRebalancesPerDay, smallBasketNavUsd);
    }

    @Bean
    public RiskGate riskGate(RiskLimits limits) {
        return new RiskGate(limits, new RebalanceFrequencyJudge());
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public KillSwitch killSwitch() {
        return new KillSwitch();
    }

    @Bean
    public LossHaltGuard lossHaltGuard(Clock clock,
                                       @Value("${safety.loss-halt.drop-fraction:0.15}") double dropFraction,
                                       @Value("${safety.loss-halt.window:PT24H}") Duration window) {
        return new LossHaltGuard(clock, dropFraction, window);
    }

    @Bean
    public PortfolioGuard portfolioGuard(RiskLimits limits) {
        return new PortfolioGuard(limits);
    }

    @Bean
    public IdempotencyGuard idempotencyGuard(Clock clock) {
        return new IdempotencyGuard(clock);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
