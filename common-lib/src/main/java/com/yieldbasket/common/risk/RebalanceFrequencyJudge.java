package com.yieldbasket.common.risk;

import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.weights.WeightMath;

import java.util.Locale;

/**
 * Default soft judgment.
 *
 * <ul>
 *   <li>Veto when the basket already rebalanced {@code maxRebalancesPerDay} times in 24h,
 *       or at all when NAV is below {@code smallBasketNavUsd} (fees dominate small baskets).</li>
 *   <li>Halve the move when the RISK producer is confidently bearish.</li>
 *   <li>Shrink a move that uses more than {@value #NEAR_CAP_FRACTION} of the aggregate cap
 *       down to that fraction.</li>
 * </ul>
 */
public class RebalanceFrequencyJudge implements SoftRiskJudge {

    static final double NEAR_CAP_FRACTION      = 0.8;
    static final double BEARISH_CONFIDENCE_BAR = 0.75;

    @Override
    public SoftRiskJudgment judge(RiskInput input, RiskLimits limits) {
        if (input.rebalancesLast24h() >= limits.maxRebalancesPerDay()) {
            return SoftRiskJudgment.veto(String.format(Locale.ROOT,
                "rebalance frequency %d in 24h reached limit %d",
                input.rebalancesLast24h(), limits.maxRebalancesPerDay()));
        }
        if (input.navUsd() < limits.smallBasketNavUsd() && input.rebalancesLast24h() >= 1) {
            return SoftRiskJudgment.veto(String.format(Locale.ROOT,
                "basket NAV %.0f below %.0f allows one rebalance per 24h",
                input.navUsd(), limits.smallBasketNavUsd()));
        }

        double change = WeightMath.aggregateChange(input.currentWeights(), input.proposedWeights());
        double fraction = 1.0;
        String reason = null;

        var risk = input.riskReport();
        if (risk != null && !risk.isError() && risk.signal() == Signal.BEARISH
                && risk.confidence() >= BEARISH_CONFIDENCE_BAR) {
            fraction = 0.5;
            reason = String.format(Locale.ROOT, "risk report bearish at %.2f, move halved", risk.confidence());
        }

        double nearCap = limits.maxAggregateChange() * NEAR_CAP_FRACTION;
        if (change * fraction > nearCap && change > 0.0) {
            fraction = nearCap / change;
            reason = String.format(Locale.ROOT, "aggregate change %.4f shrunk to %.4f", change, nearCap);
        }

        if (fraction >= 1.0) {
            return SoftRiskJudgment.pass();
        }
        return SoftRiskJudgment.adjust(
            WeightMath.shrinkToward(input.currentWeights(), input.proposedWeights(), fraction), reason);
    }
}
