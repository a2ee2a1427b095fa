package com.yieldbasket.scheduler.job;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.Disposable;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Self-rescheduling loop: {@code delay(interval) → tick → next interval → repeat}.
 *
 * <p>Each tick is a fresh {@link Mono} pipeline whose terminal {@code subscribe()} schedules
 * the next one, so there is no stack growth and no thread is held during the wait. A tick
 * that errors or completes empty is absorbed and the loop reschedules with the fallback
 * interval. The loop only ends through {@link #stop()}.
 */
public final class PeriodicLoop {

    private static final Logger log = LoggerFactory.getLogger(PeriodicLoop.class);

    private final String                   name;
    private final Scheduler                scheduler;
    private final Supplier<Mono<Duration>> tick;
    private final Duration                 fallback;

    private final AtomicBoolean running = new AtomicBoolean();
    private final AtomicLong    ticks   = new AtomicLong();
    private volatile Disposable pending;
    private volatile Duration   lastInterval;

    public PeriodicLoop(String name, Scheduler scheduler, Supplier<Mono<Duration>> tick, Duration fallback) {
        this.name      = name;
        this.scheduler = scheduler;
        this.tick      = tick;
        this.fallback  = fallback;
    }

    public void start(Duration initialDelay) {
        if (!running.compareAndSet(false, true)) {
            log.warn("[Loop] already running name={}", name);
            return;
        }
        log.info("[Loop] started name={} initialDelaySeconds={}", name, initialDelay.toSeconds());
        scheduleNext(initialDelay);
    }

    public void stop() {
        if (running.compareAndSet(true, false)) {
            Disposable current = pending;
            if (current != null) current.dispose();
            log.info("[Loop] stopped name={} ticks={}", name, ticks.get());
        }
    }

    public boolean isRunning()      { return running.get(); }
    public long ticks()             { return ticks.get(); }
    public Duration lastInterval()  { return lastInterval; }

    private void scheduleNext(Duration delay) {
        if (!running.get()) return;
        lastInterval = delay;
        pending = Mono.delay(delay, scheduler)
            .then(Mono.defer(tick))
            .defaultIfEmpty(fallback)
            .subscribe(
                next -> {
                    ticks.incrementAndGet();
                    log.info("[Loop] tick done name={} nextIntervalSeconds={}", name, next.toSeconds());
                    scheduleNext(next);
                },
                err -> {
                    ticks.incrementAndGet();
                    log.error("[Loop] tick failed name={}, rescheduling with fallback interval", name, err);
                    scheduleNext(fallback);
                }
            );
    }
}
