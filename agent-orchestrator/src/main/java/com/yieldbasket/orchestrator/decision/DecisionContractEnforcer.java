package com.yieldbasket.orchestrator.decision;

import com.yieldbasket.common.exception.DecisionContractViolationException;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.RiskVerdict;
import com.yieldbasket.common.weights.WeightMath;

/** Hard checks on a {@link DecisionProposal}. Throws instead of repairing. */
public final class DecisionContractEnforcer {

    private DecisionContractEnforcer() {}

    public static DecisionProposal enforce(RiskVerdict verdict, DecisionProposal proposal) {
        if (verdict.isVeto() && proposal.action() != DecisionAction.HOLD) {
            throw new DecisionContractViolationException(proposal.action(),
                "risk verdict is a veto, only HOLD is admissible");
        }
        if (proposal.action() == DecisionAction.SKIPPED) {
            throw new DecisionContractViolationException(proposal.action(), "SKIPPED is reserved for safety halts");
        }
        if (proposal.action() == DecisionAction.REBALANCE) {
            if (!WeightMath.sumsToOne(proposal.targetWeights(), Decision.WEIGHT_SUM_TOLERANCE)) {
                throw new DecisionContractViolationException(proposal.action(),
                    "rebalance weights sum to " + WeightMath.sum(proposal.targetWeights()));
            }
            if (!verdict.adjustedWeights().isEmpty()
                    && WeightMath.aggregateChange(verdict.adjustedWeights(), proposal.targetWeights())
                       > Decision.WEIGHT_SUM_TOLERANCE) {
                throw new DecisionContractViolationException(proposal.action(),
                    "rebalance weights differ from the risk-approved weights");
            }
        }
        return proposal;
    }
}
