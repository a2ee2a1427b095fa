package com.yieldbasket.staking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Pool totals plus an APY estimate: the last 30 days of deposits annualised over
 * total principal. Zero while nothing is staked.
 */
public record PoolStats(
    @JsonProperty("totalPrincipalRaw") long totalPrincipalRaw,
    @JsonProperty("totalWeightedStakeRaw") long totalWeightedStakeRaw,
    @JsonProperty("participants") long participants,
    @JsonProperty("accumulator") String accumulator,
    @JsonProperty("totalDepositedRaw") long totalDepositedRaw,
    @JsonProperty("retainedDustRaw") long retainedDustRaw,
    @JsonProperty("deposits30dRaw") long deposits30dRaw,
    @JsonProperty("estimatedApy") double estimatedApy,
    @JsonProperty("lastUpdate") Instant lastUpdate
) {}
