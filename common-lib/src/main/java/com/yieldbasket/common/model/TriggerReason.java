package com.yieldbasket.common.model;

public enum TriggerReason {
    SCHEDULED,
    LOSS_EVENT,
    SENTIMENT_EVENT
}
