package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.risk.RiskLimits;
import com.yieldbasket.common.weights.WeightMath;

import java.util.Map;
import java.util.TreeMap;

/**
 * Drafts target weights for the change advocate: tilt held tokens by their recent momentum,
 * lean into the anchor when the majority is bearish, then fit the draft inside the per-token
 * cap, the anchor floor and a share of the aggregate-change limit. Never adds a new token.
 */
public final class TargetWeightPlanner {

    static final double MOMENTUM_SENSITIVITY = 1.0;
    static final double MOMENTUM_CLAMP       = 0.5;
    static final double DEFENSIVE_ANCHOR_TILT = 0.5;
    static final double CHANGE_HEADROOM      = 0.8;
    private static final int FIT_PASSES      = 10;

    private TargetWeightPlanner() {}

    public static Map<String, Double> plan(Map<String, Double> current, Map<String, Double> trendMetrics,
                                           Signal direction, RiskLimits limits) {
        if (current.isEmpty()) return Map.of();

        Map<String, Double> raw = new TreeMap<>();
        current.forEach((token, weight) -> {
            if (weight <= 0.0) return;
            if (token.equals(limits.anchorToken())) {
                raw.put(token, direction == Signal.BEARISH ? weight * (1 + DEFENSIVE_ANCHOR_TILT) : weight);
                return;
            }
            Double momentum = trendMetrics.get("momentum:" + token);
            double tilt = momentum == null || momentum.isNaN() ? 1.0
                : Math.exp(MOMENTUM_SENSITIVITY * Math.max(-MOMENTUM_CLAMP, Math.min(MOMENTUM_CLAMP, momentum)));
            raw.put(token, weight * tilt);
        });

        Map<String, Double> target = fitCapAndFloor(WeightMath.normalize(raw), limits);

        double change = WeightMath.aggregateChange(current, target);
        double budget = limits.maxAggregateChange() * CHANGE_HEADROOM;
        if (change > budget) {
            target = WeightMath.shrinkToward(current, target, budget / change);
        }
        return target;
    }

    /** Moves excess above the cap onto uncapped tokens and tops the anchor up to its floor. */
    static Map<String, Double> fitCapAndFloor(Map<String, Double> weights, RiskLimits limits) {
        Map<String, Double> w = new TreeMap<>(weights);
        for (int pass = 0; pass < FIT_PASSES; pass++) {
            double excess = 0.0;
            double roomWeight = 0.0;
            for (Map.Entry<String, Double> e : w.entrySet()) {
                if (e.getValue() > limits.maxTokenWeight()) {
                    excess += e.getValue() - limits.maxTokenWeight();
                    e.setValue(limits.maxTokenWeight());
                } else if (e.getValue() < limits.maxTokenWeight()) {
                    roomWeight += e.getValue();
                }
            }
            if (excess <= 0.0 || roomWeight <= 0.0) break;
            final double share = excess / roomWeight;
            w.replaceAll((token, v) -> v < limits.maxTokenWeight() ? v * (1 + share) : v);
        }

        String anchor = limits.anchorToken();
        if (w.containsKey(anchor) && w.get(anchor) < limits.anchorFloor()) {
            double deficit = limits.anchorFloor() - w.get(anchor);
            double others = WeightMath.sum(w) - w.get(anchor);
            if (others > 0.0) {
                final double scale = (others - deficit) / others;
                w.replaceAll((token, v) -> token.equals(anchor) ? limits.anchorFloor() : v * scale);
            }
        }
        return WeightMath.normalize(w);
    }
}
