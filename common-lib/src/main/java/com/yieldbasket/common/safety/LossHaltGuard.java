package com.yieldbasket.common.safety;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Locale;

/**
 * Trips when NAV falls more than {@code dropFraction} below its highest observation inside
 * the trailing window. Once tripped the halt is sticky: only {@link #clear()} lifts it,
 * regardless of later recoveries.
 */
public class LossHaltGuard {

    public static final String NAME = "loss-halt";

    private record NavSample(Instant at, double nav) {}

    private final Clock clock;
    private final double dropFraction;
    private final Duration window;
    private final Deque<NavSample> samples = new ArrayDeque<>();

    private String haltReason;
    private Instant haltedAt;

    public LossHaltGuard(Clock clock, double dropFraction, Duration window) {
        if (dropFraction <= 0.0 || dropFraction >= 1.0) {
            throw new IllegalArgumentException("dropFraction must be within (0,1), got " + dropFraction);
        }
        this.clock        = clock;
        this.dropFraction = dropFraction;
        this.window       = window;
    }

    /**
     * Records a NAV observation and evaluates the trailing drawdown.
     *
     * @return true when this observation tripped the halt (false if it was already set or did not trip)
     */
    public synchronized boolean observe(double nav) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        while (!samples.isEmpty() && samples.peekFirst().at().isBefore(cutoff)) {
            samples.pollFirst();
        }
        samples.addLast(new NavSample(now, nav));

        if (haltReason != null) return false;

        double peak = samples.stream().mapToDouble(NavSample::nav).max().orElse(nav);
        if (peak <= 0.0) return false;
        double drop = (peak - nav) / peak;
        if (drop > dropFraction) {
            haltReason = String.format(Locale.ROOT,
                "NAV dropped %.2f%% from %.2f to %.2f within %s (limit %.2f%%)",
                drop * 100, peak, nav, window, dropFraction * 100);
            haltedAt = now;
            return true;
        }
        return false;
    }

    public synchronized boolean isHalted() {
        return haltReason != null;
    }

    public synchronized String haltReason() {
        return haltReason;
    }

    public synchronized Instant haltedAt() {
        return haltedAt;
    }

    /**
     * Re-applies a halt recorded before a restart. The sample window starts empty; the halt
     * itself stays until {@link #clear()}.
     */
    public synchronized void restore(String reason, Instant haltedAt) {
        if (reason == null || reason.isBlank()) {
            throw new IllegalArgumentException("a restored halt needs its reason");
        }
        this.haltReason = reason;
        this.haltedAt   = haltedAt;
    }

    /** Manual clear. Drops the sample window too, so the pre-halt peak cannot re-trip it. */
    public synchronized void clear() {
        haltReason = null;
        haltedAt   = null;
        samples.clear();
    }

    public synchronized GuardResult check() {
        return haltReason == null ? GuardResult.allow(NAME) : GuardResult.block(NAME, "loss halt: " + haltReason);
    }
}
