package com.yieldbasket.orchestrator.decision;

/**
 * Chooses the cycle's action from the last debate round and the risk verdict.
 * When the verdict is a veto the only admissible answer is HOLD; the orchestrator
 * checks this with {@link DecisionContractEnforcer} and rejects anything else.
 */
public interface DecisionMaker {

    DecisionProposal decide(DecisionInput input);
}
