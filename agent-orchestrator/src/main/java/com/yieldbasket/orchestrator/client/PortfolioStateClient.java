package com.yieldbasket.orchestrator.client;

import com.yieldbasket.common.model.BasketSnapshot;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** Current basket composition, NAV, depth and price history from the portfolio reader. */
@Component
public class PortfolioStateClient {

    private final WebClient portfolioReaderClient;

    public PortfolioStateClient(WebClient portfolioReaderClient) {
        this.portfolioReaderClient = portfolioReaderClient;
    }

    public Mono<BasketSnapshot> snapshot(String traceId) {
        return portfolioReaderClient.get()
            .uri("/api/v1/basket/snapshot")
            .header("X-Trace-Id", traceId)
            .retrieve()
            .bodyToMono(BasketSnapshot.class);
    }
}
