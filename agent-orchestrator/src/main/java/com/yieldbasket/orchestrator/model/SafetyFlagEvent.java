package com.yieldbasket.orchestrator.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/**
 * Append-only change of an operator safety flag. The newest row per {@code flag}
 * is the state a restarted orchestrator comes back with.
 *
 *   flag      → "kill-switch" or "loss-halt"
 *   engaged   → false for a release or manual clear
 *   raisedAt  → when the halt tripped; null for the kill switch and for clears
 */
@Data
@NoArgsConstructor
@Table("safety_flag_event")
public class SafetyFlagEvent {

    @Id
    private Long id;

    private String flag;

    private boolean engaged;

    private String reason;

    private LocalDateTime raisedAt;

    private LocalDateTime recordedAt;
}
