package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * One specialist's structured opinion for a single cycle.
 *
 * <p>{@code metrics} holds the producer's structured numbers (for example
 * {@code momentum:SOL}); the debate reads them when drafting target weights.
 *
 * <p>A report with a non-null {@code error} is a failed report: its signal is
 * {@link Signal#NEUTRAL} and its confidence is zero. Failed reports still flow
 * through the cycle so the orchestrator can count failures uniformly.
 */
public record AnalystReport(
    @JsonProperty("producer") ProducerKind producer,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("signal") Signal signal,
    @JsonProperty("evidence") List<String> evidence,
    @JsonProperty("metrics") Map<String, Double> metrics,
    @JsonProperty("error") String error,
    @JsonProperty("producedAt") Instant producedAt
) {
    public AnalystReport {
        if (producer == null) {
            throw new IllegalArgumentException("producer is required");
        }
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1], got " + confidence);
        }
        signal          = signal != null ? signal : Signal.NEUTRAL;
        evidence        = evidence != null ? List.copyOf(evidence) : List.of();
        metrics         = metrics != null ? Map.copyOf(metrics) : Map.of();
        producedAt      = producedAt != null ? producedAt : Instant.now();
    }

    public static AnalystReport of(ProducerKind producer, double confidence, Signal signal,
                                   List<String> evidence, Map<String, Double> metrics) {
        return new AnalystReport(producer, confidence, signal, evidence, metrics, null, Instant.now());
    }

    public static AnalystReport failed(ProducerKind producer, String reason) {
        return new AnalystReport(producer, 0.0, Signal.NEUTRAL, List.of(), null,
                                 reason != null ? reason : "unknown failure", Instant.now());
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }
}
