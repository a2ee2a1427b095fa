package com.yieldbasket.common.safety;

import com.yieldbasket.common.risk.HardLimitChecker;
import com.yieldbasket.common.risk.RiskInput;
import com.yieldbasket.common.risk.RiskLimits;

import java.util.List;

/**
 * Execution-time re-check of the hard limits against a fresh snapshot, in case the
 * basket moved between the decision and its submission.
 */
public class PortfolioGuard {

    public static final String NAME = "portfolio";

    private final RiskLimits limits;

    public PortfolioGuard(RiskLimits limits) {
        this.limits = limits;
    }

    public GuardResult check(RiskInput atExecution) {
        List<String> violations = HardLimitChecker.check(atExecution, limits);
        return violations.isEmpty()
            ? GuardResult.allow(NAME)
            : GuardResult.block(NAME, "hard limits breached at execution: " + String.join("; ", violations));
    }
}
