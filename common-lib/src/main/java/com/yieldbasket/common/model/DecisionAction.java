package com.yieldbasket.common.model;

/**
 * Final action of a cycle. {@link #SKIPPED} is reserved for cycles blocked by the
 * kill switch or the loss halt and is never proposed by a decision maker.
 */
public enum DecisionAction {
    REBALANCE,
    HOLD,
    EMERGENCY_EXIT,
    SKIPPED
}
