package com.yieldbasket.common.safety;

/** Outcome of one guard consultation. {@code reason} is null when allowed. */
public record GuardResult(String guard, boolean allowed, String reason) {

    public static GuardResult allow(String guard) {
        return new GuardResult(guard, true, null);
    }

    public static GuardResult block(String guard, String reason) {
        return new GuardResult(guard, false, reason);
    }
}
