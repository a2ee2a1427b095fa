package com.yieldbasket.scheduler.job;

import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.scheduler.client.OrchestratorClient;
import com.yieldbasket.scheduler.config.SchedulerProperties;
import com.yieldbasket.scheduler.strategy.TempoStrategy;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/** Fires a SCHEDULED decision cycle on every tick. */
@Component
public class DecisionCycleJob {

    private static final Logger log = LoggerFactory.getLogger(DecisionCycleJob.class);

    private final OrchestratorClient  orchestratorClient;
    private final SchedulerProperties properties;
    private final PeriodicLoop        loop;

    public DecisionCycleJob(OrchestratorClient orchestratorClient, SchedulerProperties properties,
                            Scheduler loopScheduler) {
        this.orchestratorClient = orchestratorClient;
        this.properties         = properties;
        this.loop               = new PeriodicLoop("decision-cycle", loopScheduler, this::runOnce,
                                                   properties.failureBackoff());
    }

    @PostConstruct
    public void start() {
        if (!properties.enabled()) {
            log.info("[Cycle] scheduler disabled, decision loop not started");
            return;
        }
        loop.start(properties.initialDelay());
    }

    @PreDestroy
    public void stop() {
        loop.stop();
    }

    Mono<Duration> runOnce() {
        return orchestratorClient.triggerCycle(TriggerReason.SCHEDULED)
            .map(outcome -> TempoStrategy.afterCycle(outcome, properties));
    }

    PeriodicLoop loop() {
        return loop;
    }
}
