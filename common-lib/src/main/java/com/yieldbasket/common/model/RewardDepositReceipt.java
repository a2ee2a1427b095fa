package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Outcome of a reward deposit.
 *
 * @param creditedRaw amount that reached staker balances through the accumulator
 * @param dustRaw     floored remainder kept by the pool
 * @param duplicate   true when the reference was already deposited and this is the original receipt
 */
public record RewardDepositReceipt(
    @JsonProperty("reference") String reference,
    @JsonProperty("amountRaw") long amountRaw,
    @JsonProperty("creditedRaw") long creditedRaw,
    @JsonProperty("dustRaw") long dustRaw,
    @JsonProperty("accumulator") String accumulator,
    @JsonProperty("depositedAt") Instant depositedAt,
    @JsonProperty("duplicate") boolean duplicate
) {
    public RewardDepositReceipt asDuplicate() {
        return new RewardDepositReceipt(reference, amountRaw, creditedRaw, dustRaw, accumulator, depositedAt, true);
    }
}
