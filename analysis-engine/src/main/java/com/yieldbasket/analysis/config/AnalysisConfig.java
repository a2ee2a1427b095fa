package com.yieldbasket.analysis.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.yieldbasket.common.llm.AnthropicCompletionClient;
import com.yieldbasket.common.llm.CompletionClient;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;

@Configuration
public class AnalysisConfig {

    @Value("${anthropic.base-url:" + AnthropicCompletionClient.DEFAULT_BASE_URL + "}")
    private String anthropicBaseUrl;

    @Value("${anthropic.api-key:}")
    private String anthropicApiKey;

    @Value("${anthropic.model:claude-3-5-haiku-latest}")
    private String anthropicModel;

    @Value("${anthropic.max-tokens:400}")
    private int maxTokens;

    @Bean
    public CompletionClient completionClient(WebClient.Builder builder, ObjectMapper objectMapper) {
        return new AnthropicCompletionClient(builder, objectMapper, anthropicBaseUrl,
                                             anthropicApiKey, anthropicModel, maxTokens);
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
