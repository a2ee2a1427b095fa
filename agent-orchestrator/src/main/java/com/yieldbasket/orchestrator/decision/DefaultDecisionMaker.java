package com.yieldbasket.orchestrator.decision;

import com.yieldbasket.common.model.DebateThesis;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.RiskVerdict;
import com.yieldbasket.common.weights.WeightMath;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Sides with the change advocate only when its final confidence beats the hold advocate's,
 * and only when the expected fee does not outweigh the expected benefit of the move.
 * Expected benefit is the moved fraction times the confidence margin times the configured edge.
 */
@Component
public class DefaultDecisionMaker implements DecisionMaker {

    private final FeeEstimator feeEstimator;
    private final double feeBenefitRatio;
    private final double expectedEdge;

    public DefaultDecisionMaker(FeeEstimator feeEstimator,
                                @Value("${orchestrator.fee-benefit-ratio:1.0}") double feeBenefitRatio,
                                @Value("${orchestrator.expected-edge:0.10}") double expectedEdge) {
        this.feeEstimator    = feeEstimator;
        this.feeBenefitRatio = feeBenefitRatio;
        this.expectedEdge    = expectedEdge;
    }

    @Override
    public DecisionProposal decide(DecisionInput input) {
        RiskVerdict verdict = input.verdict();
        DebateThesis change = input.debate().finalChange();
        DebateThesis hold   = input.debate().finalHold();

        if (verdict.isVeto()) {
            String reason = verdict.violations().isEmpty()
                ? "risk veto: " + verdict.softReason()
                : "risk veto: " + String.join("; ", verdict.violations());
            return DecisionProposal.hold(hold.confidence(), reason);
        }

        if (change.proposedAction() == DecisionAction.EMERGENCY_EXIT && change.confidence() >= hold.confidence()) {
            return new DecisionProposal(DecisionAction.EMERGENCY_EXIT, Map.of(), change.confidence(), 0.0,
                List.of(fmt("emergency exit argued at %.2f against hold at %.2f", change.confidence(), hold.confidence())));
        }

        if (change.proposedAction() != DecisionAction.REBALANCE || change.confidence() <= hold.confidence()) {
            return DecisionProposal.hold(hold.confidence(), fmt("hold case %s at %.2f not beaten by change case %s at %.2f",
                hold.proposedAction(), hold.confidence(), change.proposedAction(), change.confidence()));
        }

        Map<String, Double> weights = verdict.adjustedWeights().isEmpty()
            ? change.targetWeights()
            : verdict.adjustedWeights();
        double moved = WeightMath.aggregateChange(input.currentWeights(), weights);
        double feeRatio = feeEstimator.costRatio(moved, input.navUsd());
        double benefit = moved * (change.confidence() - hold.confidence()) * expectedEdge;

        List<String> notes = new ArrayList<>();
        if (verdict.softReason() != null) notes.add("risk adjustment: " + verdict.softReason());
        if (feeRatio > feeBenefitRatio * benefit) {
            notes.add(fmt("fee cost %.6f exceeds expected benefit %.6f", feeRatio, benefit));
            return new DecisionProposal(DecisionAction.HOLD, Map.of(), hold.confidence(), feeRatio, notes);
        }
        notes.add(fmt("change case %.2f over hold case %.2f; moving %.4f at fee %.6f",
            change.confidence(), hold.confidence(), moved, feeRatio));
        return new DecisionProposal(DecisionAction.REBALANCE, weights, change.confidence(), feeRatio, notes);
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
