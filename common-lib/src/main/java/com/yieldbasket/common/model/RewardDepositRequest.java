package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reward deposit into the staking pool. {@code reference} makes the deposit idempotent:
 * the settlement service passes its bridge job id.
 */
public record RewardDepositRequest(
    @JsonProperty("reference") String reference,
    @JsonProperty("amountRaw") long amountRaw
) {}
