package com.yieldbasket.history.client;

import com.yieldbasket.common.model.BasketSnapshot;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/** Realized basket state used to score past decisions. */
@Component
public class PortfolioSnapshotClient {

    private final WebClient portfolioReaderClient;
    private final Duration timeout;

    public PortfolioSnapshotClient(WebClient portfolioReaderClient,
                                   @Value("${reflection.snapshot-timeout-ms:10000}") long timeoutMs) {
        this.portfolioReaderClient = portfolioReaderClient;
        this.timeout               = Duration.ofMillis(timeoutMs);
    }

    public Mono<BasketSnapshot> current() {
        return portfolioReaderClient.get()
            .uri("/api/v1/basket/snapshot")
            .retrieve()
            .bodyToMono(BasketSnapshot.class)
            .timeout(timeout);
    }
}
