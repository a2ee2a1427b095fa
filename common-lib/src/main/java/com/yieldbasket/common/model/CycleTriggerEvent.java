package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record CycleTriggerEvent(
    @JsonProperty("reason") TriggerReason reason,
    @JsonProperty("triggeredAt") Instant triggeredAt,
    @JsonProperty("traceId") String traceId
) {}
