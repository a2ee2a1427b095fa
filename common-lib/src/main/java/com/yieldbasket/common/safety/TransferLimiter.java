package com.yieldbasket.common.safety;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Per-job and rolling-window ceilings on bridged value, in raw 6-decimal units.
 *
 * The limiter holds no history of its own. Callers total the transfers already recorded
 * since {@link #windowStart()} and pass that in, so the ceiling survives a restart as
 * long as the record does. Callers serialise check-then-record themselves.
 */
public class TransferLimiter {

    public static final String NAME = "transfer-limiter";

    private final Clock clock;
    private final long perJobCeiling;
    private final long rollingCeiling;
    private final Duration window;

    public TransferLimiter(Clock clock, long perJobCeiling, long rollingCeiling, Duration window) {
        this.clock          = clock;
        this.perJobCeiling  = perJobCeiling;
        this.rollingCeiling = rollingCeiling;
        this.window         = window;
    }

    /** Oldest instant a recorded transfer still counts against the rolling ceiling. */
    public Instant windowStart() {
        return clock.instant().minus(window);
    }

    public GuardResult check(long amount, long usedInWindow) {
        if (amount <= 0) {
            return GuardResult.block(NAME, "transfer amount must be positive, got " + amount);
        }
        if (amount > perJobCeiling) {
            return GuardResult.block(NAME, "transfer " + amount + " exceeds per-job ceiling " + perJobCeiling);
        }
        if (usedInWindow + amount > rollingCeiling) {
            return GuardResult.block(NAME, "transfer " + amount + " would bring rolling total to "
                + (usedInWindow + amount) + " above ceiling " + rollingCeiling);
        }
        return GuardResult.allow(NAME);
    }

    /** Largest amount a new job could carry given what the window already holds. */
    public long headroom(long usedInWindow) {
        return Math.max(0L, Math.min(perJobCeiling, rollingCeiling - usedInWindow));
    }
}
