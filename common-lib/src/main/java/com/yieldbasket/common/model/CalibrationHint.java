package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Map;

/**
 * Per-producer accuracy derived from one reflected decision.
 * Append-only; producers read the most recent hints as extra context.
 */
public record CalibrationHint(
    @JsonProperty("decisionId") String decisionId,
    @JsonProperty("producerAccuracy") Map<ProducerKind, Double> producerAccuracy,
    @JsonProperty("realizedNavChange") double realizedNavChange,
    @JsonProperty("note") String note,
    @JsonProperty("createdAt") Instant createdAt
) {
    public CalibrationHint {
        producerAccuracy = producerAccuracy != null ? Map.copyOf(producerAccuracy) : Map.of();
        createdAt        = createdAt != null ? createdAt : Instant.now();
    }

    /** Accuracy for one producer, or {@code fallback} when that producer was not scored. */
    public double accuracyOf(ProducerKind kind, double fallback) {
        Double score = producerAccuracy.get(kind);
        return score != null ? score : fallback;
    }
}
