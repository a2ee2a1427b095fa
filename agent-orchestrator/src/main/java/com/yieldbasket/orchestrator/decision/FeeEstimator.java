package com.yieldbasket.orchestrator.decision;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

/** Expected settlement cost of a rebalance as a fraction of basket value. */
@Component
public class FeeEstimator {

    private final double fixedFeeUsd;
    private final double swapFeeBps;

    public FeeEstimator(@Value("${orchestrator.fee.fixed-usd:5.0}") double fixedFeeUsd,
                        @Value("${orchestrator.fee.swap-bps:30}") double swapFeeBps) {
        this.fixedFeeUsd = fixedFeeUsd;
        this.swapFeeBps  = swapFeeBps;
    }

    public double costRatio(double aggregateChange, double navUsd) {
        if (navUsd <= 0.0) return 1.0;
        double traded = aggregateChange * navUsd;
        return (fixedFeeUsd + traded * swapFeeBps / 10_000.0) / navUsd;
    }
}
