package com.yieldbasket.common.safety;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Combined view of the out-of-band flags, served to peers that gate their own mutations on it. */
public record SafetyStatus(
    @JsonProperty("killSwitchEngaged") boolean killSwitchEngaged,
    @JsonProperty("killSwitchReason") String killSwitchReason,
    @JsonProperty("lossHalted") boolean lossHalted,
    @JsonProperty("lossHaltReason") String lossHaltReason,
    @JsonProperty("lossHaltedAt") Instant lossHaltedAt
) {
    public boolean blocksMutations() {
        return killSwitchEngaged || lossHalted;
    }

    public static SafetyStatus unreachable(String detail) {
        return new SafetyStatus(true, "safety status unavailable: " + detail, false, null, null);
    }
}
