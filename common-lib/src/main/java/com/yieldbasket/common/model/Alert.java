package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/** Safety or settlement alert sent to the notification sink. */
public record Alert(
    @JsonProperty("source") String source,
    @JsonProperty("severity") Severity severity,
    @JsonProperty("title") String title,
    @JsonProperty("detail") String detail,
    @JsonProperty("traceId") String traceId,
    @JsonProperty("raisedAt") Instant raisedAt
) {
    public enum Severity { INFO, WARNING, CRITICAL }

    public static Alert critical(String source, String title, String detail, String traceId) {
        return new Alert(source, Severity.CRITICAL, title, detail, traceId, Instant.now());
    }

    public static Alert warning(String source, String title, String detail, String traceId) {
        return new Alert(source, Severity.WARNING, title, detail, traceId, Instant.now());
    }
}
