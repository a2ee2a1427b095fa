package com.yieldbasket.settlement.gateway;

import com.yieldbasket.common.model.RewardDepositReceipt;
import com.yieldbasket.common.model.RewardDepositRequest;
import reactor.core.publisher.Mono;

/** Final hop: credit the minted amount to the staking reward pool. Idempotent by reference. */
public interface RewardPoolGateway {

    Mono<RewardDepositReceipt> deposit(RewardDepositRequest request);
}
