package com.yieldbasket.settlement.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

/** Immutable transition record. {@code fromState} is null for the creation event. */
@Data
@NoArgsConstructor
@Table("bridge_event")
public class BridgeEvent {

    @Id
    private Long id;

    private Long jobId;

    private String fromState;

    private String toState;

    private String detail;

    private LocalDateTime createdAt;
}
