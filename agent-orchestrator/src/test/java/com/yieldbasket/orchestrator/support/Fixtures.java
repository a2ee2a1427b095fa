package com.yieldbasket.orchestrator.support;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.risk.RiskLimits;
import com.yieldbasket.orchestrator.debate.DebateContext;
import com.yieldbasket.orchestrator.fanout.FanOutResult;
import com.yieldbasket.common.model.TriggerReason;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/** Shared basket and report fixtures for orchestrator tests. */
public final class Fixtures {

    public static final Map<String, Double> CURRENT =
        Map.of("USDC", 0.10, "SOL", 0.25, "ETH", 0.25, "BTC", 0.25, "JUP", 0.15);

    public static final Map<String, Double> DEEP =
        Map.of("USDC", 9e9, "SOL", 9e9, "ETH", 9e9, "BTC", 9e9, "JUP", 9e9);

    public static final Map<String, Double> MOMENTUM =
        Map.of("momentum:SOL", 0.10, "momentum:ETH", -0.05, "momentum:BTC", 0.02);

    private Fixtures() {}

    public static BasketSnapshot snapshot(double nav) {
        return new BasketSnapshot(CURRENT, nav, DEEP,
            Map.of("SOL", List.of(150.0, 140.0), "ETH", List.of(3000.0, 3100.0)),
            List.of(nav, nav), Instant.parse("2026-03-01T00:00:00Z"));
    }

    public static AnalystReport report(ProducerKind kind, Signal signal, double confidence) {
        Map<String, Double> metrics = kind == ProducerKind.TREND ? MOMENTUM : Map.of();
        return AnalystReport.of(kind, confidence, signal, List.of(kind + " sees " + signal), metrics);
    }

    /** Scenario A reports: all bullish at 0.8, 0.6, 0.7, 0.5. */
    public static List<AnalystReport> allBullish() {
        return List.of(
            report(ProducerKind.TREND, Signal.BULLISH, 0.8),
            report(ProducerKind.LIQUIDITY, Signal.BULLISH, 0.6),
            report(ProducerKind.SENTIMENT, Signal.BULLISH, 0.7),
            report(ProducerKind.RISK, Signal.BULLISH, 0.5));
    }

    public static DebateContext context(List<AnalystReport> reports) {
        return new DebateContext("trace-test", TriggerReason.SCHEDULED, snapshot(1_000_000),
            new FanOutResult(reports), RiskLimits.defaults(), List.of(), List.of(), 0);
    }
}
