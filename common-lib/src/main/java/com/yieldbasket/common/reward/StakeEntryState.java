package com.yieldbasket.common.reward;

import java.math.BigInteger;
import java.time.Instant;

/**
 * One participant's position. A full unstake zeroes principal and weight but keeps
 * the row and any settled-but-unclaimed reward.
 */
public record StakeEntryState(
    String owner,
    long principal,
    long weightedStake,
    int multiplierBps,
    Instant stakeStart,
    BigInteger accumulatorSnapshot,
    long unclaimedReward,
    Instant lastInteraction
) {
    public StakeEntryState {
        if (owner == null || owner.isBlank()) {
            throw new IllegalArgumentException("owner is required");
        }
        accumulatorSnapshot = accumulatorSnapshot != null ? accumulatorSnapshot : BigInteger.ZERO;
    }

    public static StakeEntryState fresh(String owner, BigInteger accumulator, Instant now) {
        return new StakeEntryState(owner, 0L, 0L, RewardTier.BASE.multiplierBps(), null, accumulator, 0L, now);
    }

    public boolean isActive() {
        return principal > 0;
    }
}
