package com.yieldbasket.settlement.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CreateJobRequest(
    @JsonProperty("amountRaw") long amountRaw,
    @JsonProperty("reason") String reason
) {}
