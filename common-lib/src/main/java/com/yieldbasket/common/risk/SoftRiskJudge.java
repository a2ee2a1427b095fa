package com.yieldbasket.common.risk;

/**
 * Judgment applied only after every hard limit has passed.
 * May veto or shrink the proposal; must not widen it.
 */
@FunctionalInterface
public interface SoftRiskJudge {

    SoftRiskJudgment judge(RiskInput input, RiskLimits limits);
}
