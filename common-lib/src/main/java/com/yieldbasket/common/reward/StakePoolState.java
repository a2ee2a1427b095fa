package com.yieldbasket.common.reward;

import java.math.BigInteger;
import java.time.Instant;

/**
 * Immutable snapshot of the shared pool. A mutation produces a new instance;
 * the owner swaps it in only after the operation fully succeeded.
 */
public record StakePoolState(
    long totalPrincipal,
    long totalWeightedStake,
    BigInteger accumulator,
    long totalDeposited,
    long retainedDust,
    Instant lastUpdate
) {
    public StakePoolState {
        if (accumulator == null || accumulator.signum() < 0) {
            throw new IllegalArgumentException("accumulator must be non-negative");
        }
        if (totalPrincipal < 0 || totalWeightedStake < 0) {
            throw new IllegalArgumentException("pool totals must be non-negative");
        }
    }

    public static StakePoolState empty(Instant now) {
        return new StakePoolState(0L, 0L, BigInteger.ZERO, 0L, 0L, now);
    }
}
