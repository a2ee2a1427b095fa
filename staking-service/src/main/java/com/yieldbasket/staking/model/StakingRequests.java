package com.yieldbasket.staking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/** Request bodies of the staking endpoints. */
public final class StakingRequests {

    private StakingRequests() {}

    public record Stake(@JsonProperty("owner") String owner,
                        @JsonProperty("amountRaw") long amountRaw) {}

    public record Unstake(@JsonProperty("owner") String owner,
                          @JsonProperty("amountRaw") long amountRaw) {}

    public record Claim(@JsonProperty("owner") String owner) {}
}
