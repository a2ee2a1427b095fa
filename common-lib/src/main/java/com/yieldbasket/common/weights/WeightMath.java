package com.yieldbasket.common.weights;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Arithmetic over token → fraction maps.
 * Missing tokens are treated as weight zero on either side of a comparison.
 */
public final class WeightMath {

    /** Weights below this are treated as absent when counting added or removed tokens. */
    public static final double PRESENCE_EPSILON = 1e-9;

    private WeightMath() {}

    public static double sum(Map<String, Double> weights) {
        if (weights == null) return 0.0;
        return weights.values().stream().mapToDouble(Double::doubleValue).sum();
    }

    public static boolean sumsToOne(Map<String, Double> weights, double tolerance) {
        return weights != null && !weights.isEmpty() && Math.abs(sum(weights) - 1.0) <= tolerance;
    }

    /**
     * Rescales to sum exactly 1.0, dropping non-positive entries. The residual
     * floating-point error is folded into the largest weight.
     *
     * @throws IllegalArgumentException if no positive weight remains
     */
    public static Map<String, Double> normalize(Map<String, Double> weights) {
        Map<String, Double> positive = new TreeMap<>();
        if (weights != null) {
            weights.forEach((token, w) -> {
                if (w != null && w > 0.0) positive.put(token, w);
            });
        }
        double total = sum(positive);
        if (positive.isEmpty() || total <= 0.0) {
            throw new IllegalArgumentException("cannot normalize weights with no positive entry");
        }
        Map<String, Double> result = new TreeMap<>();
        positive.forEach((token, w) -> result.put(token, w / total));

        String largest = null;
        for (Map.Entry<String, Double> e : result.entrySet()) {
            if (largest == null || e.getValue() > result.get(largest)) largest = e.getKey();
        }
        double residual = 1.0 - sum(result);
        result.put(largest, result.get(largest) + residual);
        return result;
    }

    /**
     * Fraction of the basket that changes hands: half the sum of absolute per-token deltas.
     * Moving 10% from A to B yields 0.10, not 0.20.
     */
    public static double aggregateChange(Map<String, Double> current, Map<String, Double> proposed) {
        double total = 0.0;
        for (String token : union(current, proposed)) {
            total += Math.abs(weightOf(proposed, token) - weightOf(current, token));
        }
        return total / 2.0;
    }

    /** Number of tokens entering plus tokens leaving the basket. */
    public static int churn(Map<String, Double> current, Map<String, Double> proposed) {
        int count = 0;
        for (String token : union(current, proposed)) {
            boolean before = weightOf(current, token) > PRESENCE_EPSILON;
            boolean after  = weightOf(proposed, token) > PRESENCE_EPSILON;
            if (before != after) count++;
        }
        return count;
    }

    /**
     * Moves {@code proposed} toward {@code current} by keeping only {@code fraction} of each delta.
     * The result still sums to 1.0 when both inputs do.
     */
    public static Map<String, Double> shrinkToward(Map<String, Double> current,
                                                   Map<String, Double> proposed,
                                                   double fraction) {
        double f = Math.max(0.0, Math.min(1.0, fraction));
        Map<String, Double> result = new HashMap<>();
        for (String token : union(current, proposed)) {
            double from = weightOf(current, token);
            double to   = weightOf(proposed, token);
            double blended = from + (to - from) * f;
            if (blended > PRESENCE_EPSILON) result.put(token, blended);
        }
        return normalize(result);
    }

    public static double weightOf(Map<String, Double> weights, String token) {
        if (weights == null) return 0.0;
        Double w = weights.get(token);
        return w != null ? w : 0.0;
    }

    private static Set<String> union(Map<String, Double> a, Map<String, Double> b) {
        Set<String> tokens = new HashSet<>();
        if (a != null) tokens.addAll(a.keySet());
        if (b != null) tokens.addAll(b.keySet());
        return tokens;
    }
}
