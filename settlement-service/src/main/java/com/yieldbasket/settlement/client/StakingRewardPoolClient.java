package com.yieldbasket.settlement.client;

import com.yieldbasket.common.model.RewardDepositReceipt;
import com.yieldbasket.common.model.RewardDepositRequest;
import com.yieldbasket.settlement.gateway.RewardPoolGateway;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.time.Duration;

/** Deposits into staking-service. Used in dry-run too: the reward pool is ours, not a chain. */
@Component
public class StakingRewardPoolClient implements RewardPoolGateway {

    private final WebClient stakingClient;
    private final Duration timeout;

    public StakingRewardPoolClient(WebClient stakingClient,
                                   @Value("${settlement.gateway-timeout-ms:10000}") long timeoutMs) {
        this.stakingClient = stakingClient;
        this.timeout       = Duration.ofMillis(timeoutMs);
    }

    @Override
    public Mono<RewardDepositReceipt> deposit(RewardDepositRequest request) {
        return stakingClient.post()
            .uri("/api/v1/staking/deposit")
            .bodyValue(request)
            .retrieve()
            .bodyToMono(RewardDepositReceipt.class)
            .timeout(timeout);
    }
}
