package com.yieldbasket.common.risk;

import com.yieldbasket.common.model.AnalystReport;

import java.util.Map;

/**
 * Everything the risk gate looks at. Holding it in one value keeps the gate a pure function.
 *
 * @param trailingChange24h   aggregate change already executed in the trailing 24h
 * @param rebalancesLast24h   count of REBALANCE decisions in the trailing 24h
 * @param riskReport          the RISK producer's report for this cycle, may be {@code null}
 */
public record RiskInput(
    Map<String, Double> proposedWeights,
    Map<String, Double> currentWeights,
    double navUsd,
    Map<String, Double> liquidityUsd,
    double trailingChange24h,
    int rebalancesLast24h,
    AnalystReport riskReport
) {
    public RiskInput {
        proposedWeights = proposedWeights != null ? Map.copyOf(proposedWeights) : Map.of();
        currentWeights  = currentWeights != null ? Map.copyOf(currentWeights) : Map.of();
        liquidityUsd    = liquidityUsd != null ? Map.copyOf(liquidityUsd) : Map.of();
    }

    public RiskInput withProposedWeights(Map<String, Double> weights) {
        return new RiskInput(weights, currentWeights, navUsd, liquidityUsd,
                             trailingChange24h, rebalancesLast24h, riskReport);
    }
}
