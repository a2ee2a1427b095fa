package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.common.risk.RiskLimits;
import com.yieldbasket.orchestrator.fanout.FanOutResult;

import java.util.List;
import java.util.Map;

/** Read-only inputs shared by both advocates for every round of one debate. */
public record DebateContext(
    String traceId,
    TriggerReason triggerReason,
    BasketSnapshot snapshot,
    FanOutResult fanOut,
    RiskLimits limits,
    List<CalibrationHint> calibrationHints,
    List<Decision> recentDecisions,
    int rebalancesLast24h
) {
    public DebateContext {
        calibrationHints = calibrationHints != null ? List.copyOf(calibrationHints) : List.of();
        recentDecisions  = recentDecisions != null ? List.copyOf(recentDecisions) : List.of();
    }

    public Map<String, Double> currentWeights() {
        return snapshot.weights();
    }

    public Map<String, Double> trendMetrics() {
        return fanOut.report(ProducerKind.TREND)
            .filter(r -> !r.isError())
            .map(AnalystReport::metrics)
            .orElse(Map.of());
    }

    /** Majority direction among healthy reports; NEUTRAL on a tie or when neutral calls dominate. */
    public Signal dominantSignal() {
        long bullish = fanOut.healthy().stream().filter(r -> r.signal() == Signal.BULLISH).count();
        long bearish = fanOut.healthy().stream().filter(r -> r.signal() == Signal.BEARISH).count();
        long neutral = fanOut.healthy().size() - bullish - bearish;
        if (bullish > bearish && bullish >= neutral) return Signal.BULLISH;
        if (bearish > bullish && bearish >= neutral) return Signal.BEARISH;
        return Signal.NEUTRAL;
    }

    public List<AnalystReport> agreeing(Signal direction) {
        return fanOut.healthy().stream().filter(r -> r.signal() == direction).toList();
    }
}
