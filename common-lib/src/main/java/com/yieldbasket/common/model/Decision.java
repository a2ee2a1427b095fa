package com.yieldbasket.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * The permanent record of one cycle: what was decided and everything that led to it.
 *
 * <p>Carries the full audit trail (all reports, every debate round, the risk verdict)
 * plus free-form {@code notes} that spell out degraded-mode counts, violated rules and
 * producer errors, so the outcome can be reconstructed without logs.
 *
 * <p>{@code navAtDecision} and {@code pricesAtDecision} are the reference point the
 * reflection engine later compares realized movement against.
 */
public record Decision(
    @JsonProperty("decisionId") String decisionId,
    @JsonProperty("traceId") String traceId,
    @JsonProperty("triggerReason") TriggerReason triggerReason,
    @JsonProperty("action") DecisionAction action,
    @JsonProperty("priorWeights") Map<String, Double> priorWeights,
    @JsonProperty("finalWeights") Map<String, Double> finalWeights,
    @JsonProperty("confidence") double confidence,
    @JsonProperty("feeCostRatio") double feeCostRatio,
    @JsonProperty("reports") List<AnalystReport> reports,
    @JsonProperty("theses") List<DebateThesis> theses,
    @JsonProperty("verdict") RiskVerdict verdict,
    @JsonProperty("executionStatus") ExecutionStatus executionStatus,
    @JsonProperty("txReference") String txReference,
    @JsonProperty("notes") List<String> notes,
    @JsonProperty("navAtDecision") double navAtDecision,
    @JsonProperty("pricesAtDecision") Map<String, Double> pricesAtDecision,
    @JsonProperty("createdAt") Instant createdAt
) {
    public static final double WEIGHT_SUM_TOLERANCE = 1e-6;

    public Decision {
        if (decisionId == null || action == null) {
            throw new IllegalArgumentException("decisionId and action are required");
        }
        priorWeights     = priorWeights != null ? Map.copyOf(priorWeights) : Map.of();
        finalWeights     = finalWeights != null ? Map.copyOf(finalWeights) : Map.of();
        reports          = reports != null ? List.copyOf(reports) : List.of();
        theses           = theses != null ? List.copyOf(theses) : List.of();
        notes            = notes != null ? List.copyOf(notes) : List.of();
        pricesAtDecision = pricesAtDecision != null ? Map.copyOf(pricesAtDecision) : Map.of();
        executionStatus  = executionStatus != null ? executionStatus : ExecutionStatus.NOT_REQUIRED;
        createdAt        = createdAt != null ? createdAt : Instant.now();

        if (!finalWeights.isEmpty()) {
            double sum = finalWeights.values().stream().mapToDouble(Double::doubleValue).sum();
            if (Math.abs(sum - 1.0) > WEIGHT_SUM_TOLERANCE) {
                throw new IllegalArgumentException("final weights must sum to 1.0, got " + sum);
            }
        }
    }

    /** Returns a copy with the on-chain outcome attached. */
    public Decision withExecution(ExecutionStatus status, String txRef, String note) {
        List<String> updatedNotes = note == null ? notes
            : Stream.concat(notes.stream(), Stream.of(note)).toList();
        return new Decision(decisionId, traceId, triggerReason, action, priorWeights, finalWeights,
            confidence, feeCostRatio, reports, theses, verdict, status, txRef, updatedNotes,
            navAtDecision, pricesAtDecision, createdAt);
    }
}
