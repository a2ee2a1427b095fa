package com.yieldbasket.common.reward;

import com.yieldbasket.common.exception.AccumulatorOverflowException;

import java.math.BigInteger;

/**
 * Fixed-point primitives for the reward accumulator.
 *
 * <p>The accumulator is reward-per-weighted-unit scaled by {@link #PRECISION} and must stay
 * within an unsigned 128-bit range. Every division floors; whatever a floor drops is never
 * paid out and stays in the pool as dust. Amounts are raw 6-decimal units in a {@code long}.
 */
public final class RewardMath {

    public static final BigInteger PRECISION       = BigInteger.TEN.pow(18);
    public static final BigInteger MAX_ACCUMULATOR = BigInteger.ONE.shiftLeft(128).subtract(BigInteger.ONE);
    public static final int BPS_DENOMINATOR        = 10_000;

    private static final BigInteger MAX_AMOUNT = BigInteger.valueOf(Long.MAX_VALUE);

    private RewardMath() {}

    /** {@code floor(amount * PRECISION / totalWeighted)}. */
    public static BigInteger accumulatorIncrement(long amount, long totalWeightedStake) {
        if (amount <= 0) {
            throw new IllegalArgumentException("reward amount must be positive, got " + amount);
        }
        if (totalWeightedStake <= 0) {
            throw new IllegalStateException("cannot distribute reward with zero total weighted stake");
        }
        return BigInteger.valueOf(amount).multiply(PRECISION).divide(BigInteger.valueOf(totalWeightedStake));
    }

    public static BigInteger checkedAdd(BigInteger accumulator, BigInteger increment) {
        BigInteger next = accumulator.add(increment);
        if (next.compareTo(MAX_ACCUMULATOR) > 0) {
            throw new AccumulatorOverflowException("accumulator " + accumulator + " + " + increment
                + " exceeds 128-bit ceiling");
        }
        return next;
    }

    /** Reward actually distributable from an increment: {@code floor(increment * totalWeighted / PRECISION)}. */
    public static long distributed(BigInteger increment, long totalWeightedStake) {
        return toAmount(increment.multiply(BigInteger.valueOf(totalWeightedStake)).divide(PRECISION));
    }

    /** {@code floor(weightedStake * (accumulatorNow - snapshot) / PRECISION)}. */
    public static long pending(long weightedStake, BigInteger accumulatorNow, BigInteger snapshot) {
        BigInteger delta = accumulatorNow.subtract(snapshot);
        if (delta.signum() < 0) {
            throw new IllegalStateException("accumulator snapshot " + snapshot + " is ahead of pool " + accumulatorNow);
        }
        if (weightedStake == 0 || delta.signum() == 0) return 0L;
        return toAmount(BigInteger.valueOf(weightedStake).multiply(delta).divide(PRECISION));
    }

    public static long weightedStake(long principal, int multiplierBps) {
        try {
            return Math.multiplyExact(principal, (long) multiplierBps) / BPS_DENOMINATOR;
        } catch (ArithmeticException e) {
            throw new AccumulatorOverflowException("weighted stake overflow for principal " + principal, e);
        }
    }

    public static long addExact(long a, long b) {
        try {
            return Math.addExact(a, b);
        } catch (ArithmeticException e) {
            throw new AccumulatorOverflowException("amount overflow adding " + a + " + " + b, e);
        }
    }

    private static long toAmount(BigInteger value) {
        if (value.compareTo(MAX_AMOUNT) > 0) {
            throw new AccumulatorOverflowException("reward amount " + value + " exceeds 64-bit range");
        }
        return value.longValueExact();
    }
}
