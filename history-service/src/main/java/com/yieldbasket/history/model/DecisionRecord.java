package com.yieldbasket.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only row for one committed {@link com.yieldbasket.common.model.Decision}.
 *
 * Column mapping (R2DBC snake_case convention):
 *   decisionId      → decision_id
 *   triggerReason   → trigger_reason
 *   executionStatus → execution_status
 *   navAtDecision   → nav_at_decision
 *   createdAt       → created_at
 *
 * payload holds the JSON-serialised Decision (reports, theses, verdict, weights, notes)
 * reflected is the only column written after insert.
 */
@Data
@NoArgsConstructor
@Table("decision_record")
public class DecisionRecord {

    @Id
    private Long id;

    private String decisionId;

    private String traceId;

    private String triggerReason;

    private String action;

    private double confidence;

    private String executionStatus;

    private String txReference;

    private double navAtDecision;

    /** JSON-serialised {@code Decision} */
    private String payload;

    private Boolean reflected;

    private LocalDateTime createdAt;

    private LocalDateTime savedAt;
}
