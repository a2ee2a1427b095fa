package com.yieldbasket.common.reward;

import java.time.Duration;

/**
 * Time-based stake multipliers, held in basis points so weighted stake stays integral.
 * Tiers are listed lowest first.
 */
public enum RewardTier {
    BASE("Base", 0, 10_000),
    SILVER("Silver", 30, 12_500),
    GOLD("Gold", 90, 15_000);

    private final String displayName;
    private final int minDays;
    private final int multiplierBps;

    RewardTier(String displayName, int minDays, int multiplierBps) {
        this.displayName   = displayName;
        this.minDays       = minDays;
        this.multiplierBps = multiplierBps;
    }

    public String displayName() { return displayName; }
    public int minDays()        { return minDays; }
    public int multiplierBps()  { return multiplierBps; }
    public double multiplier()  { return multiplierBps / (double) RewardMath.BPS_DENOMINATOR; }

    public static RewardTier forStakeAge(Duration age) {
        long days = age == null || age.isNegative() ? 0 : age.toDays();
        return forStakeDays(days);
    }

    public static RewardTier forStakeDays(long days) {
        RewardTier result = BASE;
        for (RewardTier tier : values()) {
            if (days >= tier.minDays) result = tier;
        }
        return result;
    }

    /** Days until the next tier is reached, or {@code null} when already at the top tier. */
    public static Integer daysToNextTier(long days) {
        RewardTier current = forStakeDays(days);
        if (current.ordinal() == values().length - 1) return null;
        return (int) (values()[current.ordinal() + 1].minDays - Math.max(days, 0));
    }
}
