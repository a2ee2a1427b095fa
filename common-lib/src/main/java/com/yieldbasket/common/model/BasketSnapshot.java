package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Current on-chain composition plus the market context the producers read.
 *
 * @param weights      token → fraction of NAV
 * @param navUsd       basket net asset value in the reference currency
 * @param liquidityUsd token → tradable depth in the reference currency
 * @param priceHistory token → closing prices, newest-first
 * @param navHistory   basket NAV closes, newest-first
 */
public record BasketSnapshot(
    @JsonProperty("weights") Map<String, Double> weights,
    @JsonProperty("navUsd") double navUsd,
    @JsonProperty("liquidityUsd") Map<String, Double> liquidityUsd,
    @JsonProperty("priceHistory") Map<String, List<Double>> priceHistory,
    @JsonProperty("navHistory") List<Double> navHistory,
    @JsonProperty("observedAt") Instant observedAt
) {
    public BasketSnapshot {
        weights      = weights != null ? Map.copyOf(weights) : Map.of();
        liquidityUsd = liquidityUsd != null ? Map.copyOf(liquidityUsd) : Map.of();
        priceHistory = priceHistory != null ? Map.copyOf(priceHistory) : Map.of();
        navHistory   = navHistory != null ? List.copyOf(navHistory) : List.of();
        observedAt   = observedAt != null ? observedAt : Instant.now();
    }

    /** Latest close per token; tokens without history are omitted. */
    public Map<String, Double> latestPrices() {
        Map<String, Double> latest = new HashMap<>();
        priceHistory.forEach((token, closes) -> {
            if (closes != null && !closes.isEmpty()) latest.put(token, closes.get(0));
        });
        return latest;
    }
}
