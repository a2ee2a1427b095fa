package com.yieldbasket.scheduler.job;

import com.yieldbasket.scheduler.client.SettlementClient;
import com.yieldbasket.scheduler.config.SchedulerProperties;
import com.yieldbasket.scheduler.model.SettlementSweep;
import com.yieldbasket.scheduler.strategy.TempoStrategy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/** Evaluates the bridge trigger and advances pending jobs, faster while a job is in flight. */
@Component
public class SettlementJob {

    private static final Logger log = LoggerFactory.getLogger(SettlementJob.class);

    private final SettlementClient    settlementClient;
    private final SchedulerProperties properties;
    private final PeriodicLoop        loop;

    public SettlementJob(SettlementClient settlementClient, SchedulerProperties properties,
                         Scheduler loopScheduler) {
        this.settlementClient = settlementClient;
        this.properties       = properties;
        this.loop             = new PeriodicLoop("settlement", loopScheduler, this::runOnce,
                                                 properties.failureBackoff());
    }

    @PostConstruct
    public void start() {
        if (!properties.enabled()) {
            log.info("[Settlement] scheduler disabled, settlement loop not started");
            return;
        }
        loop.start(properties.initialDelay());
    }

    @PreDestroy
    public void stop() {
        loop.stop();
    }

    Mono<Duration> runOnce() {
        return settlementClient.sweep()
            .doOnNext(this::logSweep)
            .map(sweep -> TempoStrategy.afterSettlement(sweep, properties));
    }

    private void logSweep(SettlementSweep sweep) {
        if (sweep.trigger() != null && sweep.trigger().triggered()) {
            log.info("[Settlement] bridge job created jobId={} amountRaw={} detail={}",
                     sweep.trigger().jobId(), sweep.trigger().amountRaw(), sweep.trigger().detail());
        } else if (sweep.trigger() != null) {
            log.info("[Settlement] trigger held detail={}", sweep.trigger().detail());
        }
        if (sweep.failed() > 0) {
            log.warn("[Settlement] sweep advanced={} inFlight={} failed={}",
                     sweep.steps().size(), sweep.inFlight(), sweep.failed());
        } else {
            log.info("[Settlement] sweep advanced={} inFlight={} reachable={}",
                     sweep.steps().size(), sweep.inFlight(), sweep.reachable());
        }
    }

    PeriodicLoop loop() {
        return loop;
    }
}
