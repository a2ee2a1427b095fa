package com.yieldbasket.settlement.trigger;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class TriggerPolicyTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");
    private static final long THRESHOLD = 1_000_000_000L;

    private final TriggerPolicy policy = new TriggerPolicy(THRESHOLD, Duration.ofDays(7), 0.8);

    private static TriggerPolicy.Input input(long accumulated, double congestion, long headroom, Instant lastJobAt) {
        return new TriggerPolicy.Input(accumulated, congestion, headroom, lastJobAt, NOW);
    }

    @Test
    void thresholdReachedFires() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(THRESHOLD, 0.2, 50_000_000_000L, NOW.minusSeconds(60)));

        assertTrue(outcome.fire());
        assertEquals(TriggerPolicy.Reason.THRESHOLD, outcome.reason());
        assertEquals(THRESHOLD, outcome.amountRaw());
    }

    @Test
    void belowThresholdWaitsForFallback() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(5_000_000L, 0.2, 50_000_000_000L,
            NOW.minus(Duration.ofDays(3))));

        assertFalse(outcome.fire());
        assertThat(outcome.detail()).contains("below threshold").contains("fallback due at");
    }

    @Test
    void fallbackTimerFiresForSmallBalance() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(5_000_000L, 0.2, 50_000_000_000L,
            NOW.minus(Duration.ofDays(7))));

        assertTrue(outcome.fire());
        assertEquals(TriggerPolicy.Reason.FALLBACK_TIMER, outcome.reason());
        assertEquals(5_000_000L, outcome.amountRaw());
    }

    @Test
    @DisplayName("no earlier job counts as the fallback being due")
    void firstEverJobUsesFallback() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(5_000_000L, 0.2, 50_000_000_000L, null));

        assertTrue(outcome.fire());
        assertEquals(TriggerPolicy.Reason.FALLBACK_TIMER, outcome.reason());
    }

    @Test
    void congestionAboveCeilingBlocksEvenAtThreshold() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(THRESHOLD * 5, 0.85, 50_000_000_000L, null));

        assertFalse(outcome.fire());
        assertEquals("source chain congestion 0.85 above ceiling 0.80", outcome.detail());
    }

    @Test
    void congestionAtCeilingIsAllowed() {
        assertTrue(policy.evaluate(input(THRESHOLD, 0.8, 50_000_000_000L, null)).fire());
    }

    @Test
    void amountIsCappedByHeadroom() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(THRESHOLD * 3, 0.1, THRESHOLD * 2, null));

        assertTrue(outcome.fire());
        assertEquals(THRESHOLD * 2, outcome.amountRaw());
        assertThat(outcome.detail()).contains("capped to " + THRESHOLD * 2);
    }

    @Test
    void exhaustedCeilingBlocks() {
        TriggerPolicy.Outcome outcome = policy.evaluate(input(THRESHOLD, 0.1, 0L, null));

        assertFalse(outcome.fire());
        assertEquals("transfer ceiling exhausted", outcome.detail());
    }

    @Test
    void nothingAccumulatedNeverFires() {
        assertFalse(policy.evaluate(input(0L, 0.1, 50_000_000_000L, null)).fire());
    }
}
