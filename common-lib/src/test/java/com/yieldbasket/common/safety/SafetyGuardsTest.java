package com.yieldbasket.common.safety;

import com.yieldbasket.common.support.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SafetyGuardsTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2026-03-02T00:00:00Z"));

    // ── loss halt ───────────────────────────────────────────────────────────

    @Nested
    @DisplayName("LossHaltGuard")
    class LossHalt {

        private final LossHaltGuard guard = new LossHaltGuard(clock, 0.15, Duration.ofHours(24));

        @Test
        @DisplayName("16% drop inside 24h trips the halt and it stays set after recovery")
        void tripsAndSticks() {
            assertFalse(guard.observe(1_000_000));
            clock.advance(Duration.ofHours(6));
            assertTrue(guard.observe(840_000));
            assertTrue(guard.isHalted());

            clock.advance(Duration.ofHours(1));
            guard.observe(1_100_000);
            assertTrue(guard.isHalted());
            assertFalse(guard.check().allowed());
            assertThat(guard.haltReason()).contains("16.00%");
        }

        @Test
        @DisplayName("a drop measured against a peak older than the window does not trip")
        void peakOutsideWindow() {
            guard.observe(1_000_000);
            clock.advance(Duration.ofHours(25));
            guard.observe(900_000);
            clock.advance(Duration.ofHours(1));
            assertFalse(guard.observe(830_000));
        }

        @Test
        @DisplayName("manual clear lifts the halt")
        void clear() {
            guard.observe(1_000_000);
            guard.observe(800_000);
            guard.clear();
            assertFalse(guard.isHalted());
            assertTrue(guard.check().allowed());
        }

        @Test
        @DisplayName("a restored halt blocks a fresh guard until cleared")
        void restoredHaltSticks() {
            Instant haltedAt = clock.instant().minus(Duration.ofHours(3));
            LossHaltGuard fresh = new LossHaltGuard(clock, 0.15, Duration.ofHours(24));

            fresh.restore("NAV dropped 16.00%", haltedAt);

            assertTrue(fresh.isHalted());
            assertEquals(haltedAt, fresh.haltedAt());
            assertFalse(fresh.observe(1_000_000));
            assertEquals("loss halt: NAV dropped 16.00%", fresh.check().reason());
            fresh.clear();
            assertTrue(fresh.check().allowed());
        }
    }

    // ── transfer limiter ────────────────────────────────────────────────────

    @Nested
    @DisplayName("TransferLimiter")
    class Limiter {

        private final TransferLimiter limiter = new TransferLimiter(clock, 500, 800, Duration.ofHours(24));

        @Test
        @DisplayName("per-job ceiling applies to a single transfer")
        void perJob() {
            GuardResult result = limiter.check(501, 0);
            assertFalse(result.allowed());
            assertThat(result.reason()).contains("per-job ceiling 500");
        }

        @Test
        @DisplayName("rolling ceiling counts what the window already holds")
        void rolling() {
            assertTrue(limiter.check(500, 0).allowed());
            GuardResult second = limiter.check(400, 500);
            assertFalse(second.allowed());
            assertEquals("transfer 400 would bring rolling total to 900 above ceiling 800", second.reason());
            assertEquals(300, limiter.headroom(500));
            assertEquals(0, limiter.headroom(900));
        }

        @Test
        @DisplayName("window start trails the clock by the window length")
        void windowStart() {
            assertEquals(Instant.parse("2026-03-01T00:00:00Z"), limiter.windowStart());
            clock.advance(Duration.ofHours(25));
            assertEquals(Instant.parse("2026-03-02T01:00:00Z"), limiter.windowStart());
        }

        @Test
        @DisplayName("non-positive amounts are refused")
        void nonPositive() {
            assertFalse(limiter.check(0, 0).allowed());
        }
    }

    // ── idempotency + kill switch ───────────────────────────────────────────

    @Nested
    @DisplayName("IdempotencyGuard")
    class Idempotency {

        private final IdempotencyGuard guard = new IdempotencyGuard(clock);

        @Test
        @DisplayName("second acquire of a live key fails fast")
        void exclusive() {
            Optional<IdempotencyGuard.Lease> first = guard.tryAcquire("cycle", Duration.ofMinutes(10));
            assertTrue(first.isPresent());
            assertTrue(guard.tryAcquire("cycle", Duration.ofMinutes(10)).isEmpty());
            assertTrue(guard.tryAcquire("bridge-job:1", Duration.ofMinutes(10)).isPresent());
        }

        @Test
        @DisplayName("expired lease can be reclaimed and the stale holder cannot release it")
        void expiry() {
            IdempotencyGuard.Lease stale = guard.tryAcquire("cycle", Duration.ofMinutes(1)).orElseThrow();
            clock.advance(Duration.ofMinutes(2));
            IdempotencyGuard.Lease fresh = guard.tryAcquire("cycle", Duration.ofMinutes(1)).orElseThrow();

            assertFalse(guard.release(stale));
            assertTrue(guard.isHeld("cycle"));
            assertTrue(guard.release(fresh));
            assertFalse(guard.isHeld("cycle"));
        }
    }

    @Test
    @DisplayName("kill switch blocks until released")
    void killSwitch() {
        KillSwitch killSwitch = new KillSwitch();
        killSwitch.engage("incident 12");
        assertFalse(killSwitch.check().allowed());
        assertThat(killSwitch.check().reason()).contains("incident 12");
        killSwitch.release();
        assertTrue(killSwitch.check().allowed());
    }
}
