package com.yieldbasket.staking.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Read view of a stake entry. {@code tier} reflects the stake age right now; the stored
 * weighted stake only catches up at the owner's next interaction.
 */
public record EntryView(
    @JsonProperty("owner") String owner,
    @JsonProperty("principalRaw") long principalRaw,
    @JsonProperty("weightedStakeRaw") long weightedStakeRaw,
    @JsonProperty("multiplier") double multiplier,
    @JsonProperty("tier") String tier,
    @JsonProperty("stakeDays") long stakeDays,
    @JsonProperty("daysToNextTier") Integer daysToNextTier,
    @JsonProperty("pendingRewardRaw") long pendingRewardRaw,
    @JsonProperty("stakeStart") Instant stakeStart,
    @JsonProperty("lastInteraction") Instant lastInteraction
) {}
