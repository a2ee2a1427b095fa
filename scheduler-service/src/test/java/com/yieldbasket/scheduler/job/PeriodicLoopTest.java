package com.yieldbasket.scheduler.job;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Mono;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class PeriodicLoopTest {

    private static final Duration FALLBACK = Duration.ofMinutes(5);

    private VirtualTimeScheduler vts;
    private final AtomicInteger calls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        vts = VirtualTimeScheduler.create();
    }

    @AfterEach
    void tearDown() {
        vts.dispose();
    }

    @Nested
    @DisplayName("rescheduling")
    class Rescheduling {

        @Test
        void waitsInitialDelayThenUsesReturnedInterval() {
            PeriodicLoop loop = new PeriodicLoop("test", vts, () -> {
                calls.incrementAndGet();
                return Mono.just(Duration.ofMinutes(10));
            }, FALLBACK);

            loop.start(Duration.ofSeconds(30));
            vts.advanceTimeBy(Duration.ofSeconds(29));
            assertEquals(0, calls.get());

            vts.advanceTimeBy(Duration.ofSeconds(1));
            assertEquals(1, calls.get());

            vts.advanceTimeBy(Duration.ofMinutes(30));
            assertEquals(4, calls.get());
            assertEquals(Duration.ofMinutes(10), loop.lastInterval());
            loop.stop();
        }

        @Test
        void errorFallsBackAndLoopSurvives() {
            PeriodicLoop loop = new PeriodicLoop("test", vts, () -> {
                int n = calls.incrementAndGet();
                return n == 1 ? Mono.error(new IllegalStateException("boom")) : Mono.just(Duration.ofHours(1));
            }, FALLBACK);

            loop.start(Duration.ZERO);
            vts.advanceTime();
            assertEquals(1, calls.get());
            assertEquals(FALLBACK, loop.lastInterval());

            vts.advanceTimeBy(FALLBACK);
            assertEquals(2, calls.get());
            assertEquals(Duration.ofHours(1), loop.lastInterval());
            loop.stop();
        }

        @Test
        void synchronousThrowAndEmptyTickUseFallback() {
            PeriodicLoop loop = new PeriodicLoop("test", vts, () -> {
                int n = calls.incrementAndGet();
                if (n == 1) throw new IllegalStateException("thrown before subscribe");
                return Mono.empty();
            }, FALLBACK);

            loop.start(Duration.ZERO);
            vts.advanceTime();
            vts.advanceTimeBy(FALLBACK);

            assertEquals(2, calls.get());
            assertEquals(2, loop.ticks());
            assertEquals(FALLBACK, loop.lastInterval());
            loop.stop();
        }
    }

    @Nested
    @DisplayName("lifecycle")
    class Lifecycle {

        @Test
        void stopCancelsPendingTick() {
            PeriodicLoop loop = new PeriodicLoop("test", vts, () -> {
                calls.incrementAndGet();
                return Mono.just(Duration.ofMinutes(1));
            }, FALLBACK);

            loop.start(Duration.ofMinutes(1));
            vts.advanceTimeBy(Duration.ofMinutes(1));
            loop.stop();
            vts.advanceTimeBy(Duration.ofHours(1));

            assertEquals(1, calls.get());
            assertFalse(loop.isRunning());
        }

        @Test
        void secondStartIsIgnored() {
            PeriodicLoop loop = new PeriodicLoop("test", vts, () -> {
                calls.incrementAndGet();
                return Mono.just(Duration.ofMinutes(1));
            }, FALLBACK);

            loop.start(Duration.ofMinutes(1));
            loop.start(Duration.ZERO);
            vts.advanceTime();
            assertEquals(0, calls.get());

            vts.advanceTimeBy(Duration.ofMinutes(1));
            assertThat(calls.get()).isEqualTo(1);
            loop.stop();
        }
    }
}
