package com.yieldbasket.common.risk;

import java.util.Map;

public record SoftRiskJudgment(Outcome outcome, Map<String, Double> adjustedWeights, String reason) {

    public enum Outcome { PASS, ADJUST, VETO }

    public SoftRiskJudgment {
        adjustedWeights = adjustedWeights != null ? Map.copyOf(adjustedWeights) : Map.of();
    }

    public static SoftRiskJudgment pass() {
        return new SoftRiskJudgment(Outcome.PASS, Map.of(), null);
    }

    public static SoftRiskJudgment veto(String reason) {
        return new SoftRiskJudgment(Outcome.VETO, Map.of(), reason);
    }

    public static SoftRiskJudgment adjust(Map<String, Double> weights, String reason) {
        return new SoftRiskJudgment(Outcome.ADJUST, weights, reason);
    }
}
