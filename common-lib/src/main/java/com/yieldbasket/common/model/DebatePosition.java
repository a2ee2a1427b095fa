package com.yieldbasket.common.model;

public enum DebatePosition {
    ADVOCATE_FOR_CHANGE,
    ADVOCATE_FOR_HOLD;

    public DebatePosition opponent() {
        return this == ADVOCATE_FOR_CHANGE ? ADVOCATE_FOR_HOLD : ADVOCATE_FOR_CHANGE;
    }
}
