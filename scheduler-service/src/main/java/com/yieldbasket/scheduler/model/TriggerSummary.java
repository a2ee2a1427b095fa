package com.yieldbasket.scheduler.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/** Subset of settlement-service's trigger evaluation response. */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TriggerSummary(
    @JsonProperty("triggered") boolean triggered,
    @JsonProperty("jobId") Long jobId,
    @JsonProperty("amountRaw") long amountRaw,
    @JsonProperty("detail") String detail
) {
    public static TriggerSummary unavailable(String reason) {
        return new TriggerSummary(false, null, 0L, "unavailable: " + reason);
    }
}
