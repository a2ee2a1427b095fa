package com.yieldbasket.analysis.producer;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;

/**
 * Uniform contract for the four specialists.
 *
 * <p>Implementations are stateless and may run concurrently. They may throw; the
 * dispatch layer turns any exception or deadline miss into an error-marked report.
 */
public interface ReportProducer {

    ProducerKind kind();

    /** Rule-based report from the snapshot alone. */
    AnalystReport produce(ReportRequest request);
}
