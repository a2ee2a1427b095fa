package com.yieldbasket.common.risk;

import com.yieldbasket.common.weights.WeightMath;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Deterministic hard-limit evaluation. No model calls, no I/O, no logging.
 *
 * <p>Every rule is always evaluated, so the returned list names every breach, not just
 * the first. Output order is canonical (rule order, then token name) and therefore
 * independent of the iteration order of the input maps.
 *
 * <h3>Rules</h3>
 * <ol>
 *   <li>proposed weights sum to 1.0</li>
 *   <li>per-token weight ceiling</li>
 *   <li>anchor token floor</li>
 *   <li>aggregate change per rebalance</li>
 *   <li>tokens added plus removed</li>
 *   <li>liquidity for every non-trivial weight</li>
 *   <li>rolling 24h cumulative change</li>
 * </ol>
 */
public final class HardLimitChecker {

    static final double SUM_TOLERANCE = 1e-6;

    private HardLimitChecker() {}

    public static List<String> check(RiskInput input, RiskLimits limits) {
        Map<String, Double> proposed = new TreeMap<>(input.proposedWeights());
        Map<String, Double> current  = input.currentWeights();
        List<String> violations = new ArrayList<>();

        double sum = WeightMath.sum(proposed);
        if (Math.abs(sum - 1.0) > SUM_TOLERANCE) {
            violations.add(fmt("proposed weights sum %.6f differs from 1.0", sum));
        }

        proposed.forEach((token, weight) -> {
            if (weight > limits.maxTokenWeight() + SUM_TOLERANCE) {
                violations.add(fmt("token %s weight %.2f exceeds %.2f limit", token, weight, limits.maxTokenWeight()));
            }
        });

        double anchorWeight = WeightMath.weightOf(proposed, limits.anchorToken());
        if (anchorWeight + SUM_TOLERANCE < limits.anchorFloor()) {
            violations.add(fmt("anchor token %s weight %.2f below %.2f floor",
                               limits.anchorToken(), anchorWeight, limits.anchorFloor()));
        }

        double change = WeightMath.aggregateChange(current, proposed);
        if (change > limits.maxAggregateChange() + SUM_TOLERANCE) {
            violations.add(fmt("aggregate change %.4f exceeds %.2f limit", change, limits.maxAggregateChange()));
        }

        int churn = WeightMath.churn(current, proposed);
        if (churn > limits.maxTokenChurn()) {
            violations.add(fmt("token churn %d exceeds %d limit", churn, limits.maxTokenChurn()));
        }

        proposed.forEach((token, weight) -> {
            if (weight > limits.nonTrivialWeight()) {
                double depth = WeightMath.weightOf(input.liquidityUsd(), token);
                if (depth < limits.minLiquidityUsd()) {
                    violations.add(fmt("token %s liquidity %.0f below %.0f minimum",
                                       token, depth, limits.minLiquidityUsd()));
                }
            }
        });

        double rolling = input.trailingChange24h() + change;
        if (rolling > limits.rollingChangeCeiling() + SUM_TOLERANCE) {
            violations.add(fmt("rolling 24h change %.4f exceeds %.2f ceiling", rolling, limits.rollingChangeCeiling()));
        }

        return List.copyOf(violations);
    }

    /** Largest aggregate change still admissible this cycle given what already ran in the trailing window. */
    public static double maxAllowedChange(RiskInput input, RiskLimits limits) {
        double headroom = limits.rollingChangeCeiling() - input.trailingChange24h();
        return Math.max(0.0, Math.min(limits.maxAggregateChange(), headroom));
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
