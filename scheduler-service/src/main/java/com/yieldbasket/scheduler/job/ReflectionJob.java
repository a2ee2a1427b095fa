package com.yieldbasket.scheduler.job;

import com.yieldbasket.scheduler.client.HistoryClient;
import com.yieldbasket.scheduler.config.SchedulerProperties;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Periodic reflection sweep. Catches decisions whose delayed reflection was lost,
 * for example because the orchestrator restarted inside the delay window.
 */
@Component
public class ReflectionJob {

    private static final Logger log = LoggerFactory.getLogger(ReflectionJob.class);

    private final HistoryClient       historyClient;
    private final SchedulerProperties properties;
    private final PeriodicLoop        loop;

    public ReflectionJob(HistoryClient historyClient, SchedulerProperties properties, Scheduler loopScheduler) {
        this.historyClient = historyClient;
        this.properties    = properties;
        this.loop          = new PeriodicLoop("reflection", loopScheduler, this::runOnce, retryDelay(properties));
    }

    @PostConstruct
    public void start() {
        if (!properties.enabled()) {
            log.info("[Reflection] scheduler disabled, reflection loop not started");
            return;
        }
        loop.start(properties.initialDelay());
    }

    @PreDestroy
    public void stop() {
        loop.stop();
    }

    /** Completes with the reflection interval after a sweep, the shorter retry delay when it failed. */
    Mono<Duration> runOnce() {
        return historyClient.runReflectionSweep()
            .doOnNext(count -> log.info("[Reflection] sweep done hints={}", count))
            .map(count -> properties.reflectionInterval())
            .defaultIfEmpty(retryDelay(properties));
    }

    private static Duration retryDelay(SchedulerProperties props) {
        return props.reflectionInterval().compareTo(props.failureBackoff()) <= 0
            ? props.reflectionInterval()
            : props.failureBackoff();
    }

    PeriodicLoop loop() {
        return loop;
    }
}
