package com.yieldbasket.orchestrator.service;

import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ExecutionStatus;
import com.yieldbasket.common.weights.WeightMath;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/** Rebalances actually submitted in the trailing 24h, read from the decision history window. */
public record RecentActivity(int rebalances, double aggregateChange) {

    static final Duration WINDOW = Duration.ofHours(24);

    public static RecentActivity from(List<Decision> recent, Instant now) {
        Instant cutoff = now.minus(WINDOW);
        int count = 0;
        double change = 0.0;
        for (Decision d : recent) {
            if (d.action() != DecisionAction.REBALANCE || d.executionStatus() != ExecutionStatus.SUBMITTED) continue;
            if (d.createdAt().isBefore(cutoff)) continue;
            count++;
            change += WeightMath.aggregateChange(d.priorWeights(), d.finalWeights());
        }
        return new RecentActivity(count, change);
    }
}
