package com.yieldbasket.common.model;

/**
 * The four report specialists consulted on every cycle.
 * Fixed set; the degraded-mode rule counts failures across exactly these kinds.
 */
public enum ProducerKind {
    TREND,
    LIQUIDITY,
    SENTIMENT,
    RISK
}
