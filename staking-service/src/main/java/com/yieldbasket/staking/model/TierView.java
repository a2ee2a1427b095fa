package com.yieldbasket.staking.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.yieldbasket.common.reward.RewardTier;

public record TierView(
    @JsonProperty("name") String name,
    @JsonProperty("minDays") int minDays,
    @JsonProperty("multiplier") double multiplier,
    @JsonProperty("multiplierBps") int multiplierBps
) {
    public static TierView of(RewardTier tier) {
        return new TierView(tier.displayName(), tier.minDays(), tier.multiplier(), tier.multiplierBps());
    }
}
