package com.yieldbasket.common.safety;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Single out-of-band flag that blocks the whole decision cycle while engaged.
 * Holds the operator-supplied reason; {@code null} means released.
 */
public class KillSwitch {

    public static final String NAME = "kill-switch";

    private final AtomicReference<String> engagedReason = new AtomicReference<>();

    public void engage(String reason) {
        engagedReason.set(reason == null || reason.isBlank() ? "engaged without reason" : reason);
    }

    public void release() {
        engagedReason.set(null);
    }

    public String reason() {
        return engagedReason.get();
    }

    public boolean isEngaged() {
        return engagedReason.get() != null;
    }

    public GuardResult check() {
        String reason = engagedReason.get();
        return reason == null ? GuardResult.allow(NAME) : GuardResult.block(NAME, "kill switch engaged: " + reason);
    }
}
