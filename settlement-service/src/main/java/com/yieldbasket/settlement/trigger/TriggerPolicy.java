package com.yieldbasket.settlement.trigger;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Decides when a new bridge job should start. Pure: every input is passed in.
 *
 * <ul>
 *   <li>congestion above the ceiling always blocks</li>
 *   <li>fires when accumulated fees reach the threshold, or when the fallback interval has
 *       passed since the last job and anything at all has accumulated</li>
 *   <li>the amount is capped by the transfer limiter's headroom; no headroom blocks</li>
 * </ul>
 */
public class TriggerPolicy {

    public enum Reason { THRESHOLD, FALLBACK_TIMER }

    public record Input(long accumulatedRaw, double congestion, long headroomRaw, Instant lastJobAt, Instant now) {}

    public record Outcome(boolean fire, long amountRaw, Reason reason, String detail) {
        static Outcome hold(String detail) {
            return new Outcome(false, 0L, null, detail);
        }
    }

    private final long thresholdRaw;
    private final Duration fallbackInterval;
    private final double congestionCeiling;

    public TriggerPolicy(long thresholdRaw, Duration fallbackInterval, double congestionCeiling) {
        this.thresholdRaw      = thresholdRaw;
        this.fallbackInterval  = fallbackInterval;
        this.congestionCeiling = congestionCeiling;
    }

    public Outcome evaluate(Input in) {
        if (in.congestion() > congestionCeiling) {
            return Outcome.hold(String.format(Locale.ROOT, "source chain congestion %.2f above ceiling %.2f",
                in.congestion(), congestionCeiling));
        }
        if (in.accumulatedRaw() <= 0) {
            return Outcome.hold("nothing accumulated");
        }
        Reason reason;
        if (in.accumulatedRaw() >= thresholdRaw) {
            reason = Reason.THRESHOLD;
        } else if (in.lastJobAt() == null || !in.now().isBefore(in.lastJobAt().plus(fallbackInterval))) {
            reason = Reason.FALLBACK_TIMER;
        } else {
            return Outcome.hold("accumulated " + in.accumulatedRaw() + " below threshold " + thresholdRaw
                + ", fallback due at " + in.lastJobAt().plus(fallbackInterval));
        }
        if (in.headroomRaw() <= 0) {
            return Outcome.hold("transfer ceiling exhausted");
        }
        long amount = Math.min(in.accumulatedRaw(), in.headroomRaw());
        String detail = reason + ": accumulated " + in.accumulatedRaw()
            + (amount < in.accumulatedRaw() ? ", capped to " + amount : "");
        return new Outcome(true, amount, reason, detail);
    }

    public long thresholdRaw()          { return thresholdRaw; }
    public Duration fallbackInterval()  { return fallbackInterval; }
    public double congestionCeiling()   { return congestionCeiling; }
}
