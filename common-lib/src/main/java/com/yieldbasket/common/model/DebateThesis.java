package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * One advocate's argument for one debate round. Each round yields new instances;
 * a thesis is never edited after it is appended to the transcript.
 */
public record DebateThesis(
    @JsonProperty("position") DebatePosition position,
    @JsonProperty("proposedAction") DecisionAction proposedAction,
    @JsonProperty("targetWeights") Map<String, Double> targetWeights,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("evidence") List<String> evidence,
    @JsonProperty("round") int round
) {
    public DebateThesis {
        if (position == null || proposedAction == null) {
            throw new IllegalArgumentException("position and proposedAction are required");
        }
        if (round < 1) {
            throw new IllegalArgumentException("round starts at 1, got " + round);
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1], got " + confidence);
        }
        targetWeights = targetWeights != null ? Map.copyOf(targetWeights) : Map.of();
        evidence      = evidence != null ? List.copyOf(evidence) : List.of();
    }

    public boolean proposesChange() {
        return proposedAction == DecisionAction.REBALANCE;
    }
}
