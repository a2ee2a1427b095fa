package com.yieldbasket.common.model;

/** Directional call carried by an {@link AnalystReport}. */
public enum Signal {
    BULLISH,
    BEARISH,
    NEUTRAL
}
