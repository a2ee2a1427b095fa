package com.yieldbasket.orchestrator.decision;

import com.yieldbasket.common.model.DecisionAction;

import java.util.List;
import java.util.Map;

/** What a {@link DecisionMaker} wants to commit, before the orchestrator enforces the contract. */
public record DecisionProposal(
    DecisionAction action,
    Map<String, Double> targetWeights,
    double confidence,
    double feeCostRatio,
    List<String> notes
) {
    public DecisionProposal {
        targetWeights = targetWeights != null ? Map.copyOf(targetWeights) : Map.of();
        notes         = notes != null ? List.copyOf(notes) : List.of();
    }

    public static DecisionProposal hold(double confidence, String note) {
        return new DecisionProposal(DecisionAction.HOLD, Map.of(), confidence, 0.0, List.of(note));
    }
}
