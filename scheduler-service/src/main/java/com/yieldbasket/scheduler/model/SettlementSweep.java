package com.yieldbasket.scheduler.model;

import java.util.List;

/** One settlement tick: the trigger evaluation followed by the pending-job sweep. */
public record SettlementSweep(TriggerSummary trigger, List<StepSummary> steps, boolean reachable) {

    public SettlementSweep {
        steps = steps != null ? List.copyOf(steps) : List.of();
    }

    public long inFlight() {
        return steps.stream().filter(StepSummary::inFlight).count();
    }

    public long failed() {
        return steps.stream().filter(s -> !s.success()).count();
    }
}
