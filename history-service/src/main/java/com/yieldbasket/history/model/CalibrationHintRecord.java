package com.yieldbasket.history.model;

import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.relational.core.mapping.Table;

import java.time.LocalDateTime;

@Data
@NoArgsConstructor
@Table("calibration_hint")
public class CalibrationHintRecord {

    @Id
    private Long id;

    private String decisionId;

    /** JSON-serialised {@code Map<ProducerKind, Double>} */
    private String producerAccuracy;

    private double realizedNavChange;

    private double decisionEdge;

    private String bestProducer;

    private String worstProducer;

    private String note;

    private LocalDateTime createdAt;
}
