package com.yieldbasket.scheduler.strategy;

import com.yieldbasket.scheduler.config.SchedulerProperties;
import com.yieldbasket.scheduler.model.CycleOutcome;
import com.yieldbasket.scheduler.model.SettlementSweep;

import java.time.Duration;

/**
 * Picks the delay before each loop's next tick from the outcome of the last one.
 *
 * <ul>
 *   <li>decision cycle: the configured interval, shortened to the failure backoff after a failure</li>
 *   <li>settlement: the active interval while a job is still in flight or was just created,
 *       the idle interval otherwise, the failure backoff when settlement-service was unreachable</li>
 * </ul>
 */
public final class TempoStrategy {

    private TempoStrategy() {}

    public static Duration afterCycle(CycleOutcome outcome, SchedulerProperties props) {
        if (outcome == null || outcome.status() == CycleOutcome.Status.FAILED) {
            return shorter(props.cycleInterval(), props.failureBackoff());
        }
        return props.cycleInterval();
    }

    public static Duration afterSettlement(SettlementSweep sweep, SchedulerProperties props) {
        if (sweep == null || !sweep.reachable()) {
            return shorter(props.settlementInterval(), props.failureBackoff());
        }
        boolean active = sweep.inFlight() > 0 || (sweep.trigger() != null && sweep.trigger().triggered());
        return active
            ? shorter(props.settlementInterval(), props.settlementActiveInterval())
            : props.settlementInterval();
    }

    private static Duration shorter(Duration a, Duration b) {
        return a.compareTo(b) <= 0 ? a : b;
    }
}
