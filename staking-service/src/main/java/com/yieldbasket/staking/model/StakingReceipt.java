package com.yieldbasket.staking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Result of stake, unstake or claim. */
public record StakingReceipt(
    @JsonProperty("owner") String owner,
    @JsonProperty("operation") String operation,
    @JsonProperty("principalRaw") long principalRaw,
    @JsonProperty("weightedStakeRaw") long weightedStakeRaw,
    @JsonProperty("multiplierBps") int multiplierBps,
    @JsonProperty("rewardPaidRaw") long rewardPaidRaw,
    @JsonProperty("principalReturnedRaw") long principalReturnedRaw,
    @JsonProperty("unclaimedRewardRaw") long unclaimedRewardRaw
) {}
