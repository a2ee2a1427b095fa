package com.yieldbasket.scheduler.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

@Configuration
public class SchedulerConfig {

    @Value("${services.orchestrator.base-url}")
    private String orchestratorUrl;

    @Value("${services.history.base-url}")
    private String historyUrl;

    @Value("${services.settlement.base-url}")
    private String settlementUrl;

    @Bean
    public WebClient orchestratorClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(orchestratorUrl).build();
    }

    @Bean
    public WebClient historyClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(historyUrl).build();
    }

    @Bean
    public WebClient settlementClient(WebClient.Builder builder) {
        return builder.clone().baseUrl(settlementUrl).build();
    }

    /** Timer scheduler for the periodic loops. Tests substitute a virtual-time scheduler. */
    @Bean
    public Scheduler loopScheduler() {
        return Schedulers.parallel();
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
