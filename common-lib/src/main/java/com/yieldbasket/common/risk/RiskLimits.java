package com.yieldbasket.common.risk;

/**
 * Configured hard limits and soft-judgment thresholds for the risk gate.
 *
 * @param maxTokenWeight        per-token weight ceiling
 * @param anchorToken           token that must keep a minimum allocation
 * @param anchorFloor           minimum weight of {@code anchorToken}
 * @param maxAggregateChange    max fraction of the basket moved in one rebalance
 * @param maxTokenChurn         max tokens added plus removed in one rebalance
 * @param minLiquidityUsd       min depth for any token above {@code nonTrivialWeight}
 * @param nonTrivialWeight      weights at or below this skip the liquidity check
 * @param rollingChangeCeiling  max cumulative aggregate change across the trailing 24h
 * @param maxRebalancesPerDay   soft veto once this many rebalances happened in 24h
 * @param smallBasketNavUsd     baskets below this NAV get at most one rebalance per day
 */
public record RiskLimits(
    double maxTokenWeight,
    String anchorToken,
    double anchorFloor,
    double maxAggregateChange,
    int maxTokenChurn,
    double minLiquidityUsd,
    double nonTrivialWeight,
    double rollingChangeCeiling,
    int maxRebalancesPerDay,
    double smallBasketNavUsd
) {
    public static RiskLimits defaults() {
        return new RiskLimits(0.30, "USDC", 0.05, 0.25, 2, 250_000.0, 0.01, 0.50, 3, 50_000.0);
    }
}
