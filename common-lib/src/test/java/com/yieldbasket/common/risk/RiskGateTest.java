package com.yieldbasket.common.risk;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.RiskVerdict;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.weights.WeightMath;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RiskGateTest {

    private static final Map<String, Double> CURRENT = Map.of("USDC", 0.10, "SOL", 0.30, "ETH", 0.30, "BTC", 0.30);
    private static final Map<String, Double> DEEP = Map.of("USDC", 9e9, "SOL", 9e9, "ETH", 9e9, "BTC", 9e9, "JUP", 9e9);
    private static final Map<String, Double> SMALL_MOVE = Map.of("USDC", 0.10, "SOL", 0.25, "ETH", 0.30, "BTC", 0.30, "JUP", 0.05);

    private final RiskGate gate = new RiskGate(RiskLimits.defaults(), new RebalanceFrequencyJudge());

    private static RiskInput input(Map<String, Double> proposed, int rebalances, AnalystReport risk) {
        return new RiskInput(proposed, CURRENT, 1_000_000, DEEP, 0.0, rebalances, risk);
    }

    @Test
    @DisplayName("HOLD passes trivially even with invalid weights")
    void holdPasses() {
        RiskVerdict verdict = gate.evaluate(DecisionAction.HOLD, input(Map.of("SOL", 1.0), 99, null));
        assertTrue(verdict.approved());
        assertThat(verdict.violations()).isEmpty();
    }

    @Test
    @DisplayName("hard violation vetoes without consulting the soft judge")
    void hardVetoSkipsSoftJudge() {
        AtomicBoolean consulted = new AtomicBoolean(false);
        RiskGate spyGate = new RiskGate(RiskLimits.defaults(), (in, limits) -> {
            consulted.set(true);
            return SoftRiskJudgment.pass();
        });
        Map<String, Double> proposed = Map.of("USDC", 0.10, "SOL", 0.35, "ETH", 0.25, "BTC", 0.30);

        RiskVerdict verdict = spyGate.evaluate(DecisionAction.REBALANCE, input(proposed, 0, null));

        assertFalse(verdict.approved());
        assertEquals(List.of("token SOL weight 0.35 exceeds 0.30 limit"), verdict.violations());
        assertFalse(consulted.get());
    }

    @Test
    @DisplayName("clean proposal is approved with its own weights")
    void approveUnchanged() {
        RiskVerdict verdict = gate.evaluate(DecisionAction.REBALANCE, input(SMALL_MOVE, 0, null));
        assertTrue(verdict.approved());
        assertEquals(SMALL_MOVE, verdict.adjustedWeights());
    }

    @Test
    @DisplayName("too many rebalances in 24h is a soft veto with a reason and no hard violations")
    void frequencyVeto() {
        RiskVerdict verdict = gate.evaluate(DecisionAction.REBALANCE, input(SMALL_MOVE, 3, null));
        assertFalse(verdict.approved());
        assertThat(verdict.violations()).isEmpty();
        assertThat(verdict.softReason()).contains("rebalance frequency 3");
    }

    @Test
    @DisplayName("confidently bearish risk report halves the move")
    void bearishRiskShrinks() {
        AnalystReport bearish = AnalystReport.of(ProducerKind.RISK, 0.9, Signal.BEARISH, List.of("vol spike"), null);
        RiskVerdict verdict = gate.evaluate(DecisionAction.REBALANCE, input(SMALL_MOVE, 0, bearish));

        assertTrue(verdict.approved());
        assertEquals(0.025, WeightMath.aggregateChange(CURRENT, verdict.adjustedWeights()), 1e-9);
        assertThat(verdict.softReason()).contains("halved");
    }
}
