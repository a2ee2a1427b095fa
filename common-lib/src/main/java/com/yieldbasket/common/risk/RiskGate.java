package com.yieldbasket.common.risk;

import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.RiskVerdict;

import java.util.List;

/**
 * Pure veto gate in front of the decision maker.
 *
 * <h3>Evaluation order</h3>
 * <ol>
 *   <li>HOLD passes trivially.</li>
 *   <li>Hard limits; any breach is an unconditional veto listing every breached rule.
 *       The soft judge is not consulted.</li>
 *   <li>Soft judgment; may veto or return shrunk weights. Shrunk weights are re-checked
 *       against the hard limits and discarded in favour of the original proposal if they fail.</li>
 * </ol>
 */
public class RiskGate {

    private final RiskLimits limits;
    private final SoftRiskJudge softJudge;

    public RiskGate(RiskLimits limits, SoftRiskJudge softJudge) {
        this.limits    = limits;
        this.softJudge = softJudge;
    }

    public RiskLimits limits() {
        return limits;
    }

    public RiskVerdict evaluate(DecisionAction proposedAction, RiskInput input) {
        double maxAllowed = HardLimitChecker.maxAllowedChange(input, limits);
        if (proposedAction != DecisionAction.REBALANCE) {
            return RiskVerdict.holdPasses(maxAllowed);
        }

        List<String> violations = HardLimitChecker.check(input, limits);
        if (!violations.isEmpty()) {
            return RiskVerdict.hardVeto(violations, maxAllowed);
        }

        SoftRiskJudgment judgment = softJudge.judge(input, limits);
        return switch (judgment.outcome()) {
            case VETO -> RiskVerdict.softVeto(judgment.reason(), maxAllowed);
            case PASS -> RiskVerdict.approve(input.proposedWeights(), maxAllowed, null);
            case ADJUST -> {
                List<String> recheck = HardLimitChecker.check(input.withProposedWeights(judgment.adjustedWeights()), limits);
                yield recheck.isEmpty()
                    ? RiskVerdict.approve(judgment.adjustedWeights(), maxAllowed, judgment.reason())
                    : RiskVerdict.approve(input.proposedWeights(), maxAllowed,
                                          "adjustment discarded, breaches " + recheck);
            }
        };
    }
}
