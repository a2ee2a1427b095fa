package com.yieldbasket.orchestrator.logger;

import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.trace.TraceContextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Signal;

import java.util.function.Consumer;

/**
 * Stage logging for the decision cycle. Side effects only; never alters the pipeline.
 *
 * <p>Stages, in order:
 * <ol>
 *   <li>{@link #CYCLE_START}      cycle lock acquired, trigger accepted</li>
 *   <li>{@link #SAFETY_CHECK}     snapshot read, kill switch and loss halt consulted</li>
 *   <li>{@link #REPORTS_GATHERED} all four producers answered or timed out</li>
 *   <li>{@link #DEBATE_DONE}      bounded debate finished</li>
 *   <li>{@link #RISK_VERDICT}     risk gate evaluated the change thesis</li>
 *   <li>{@link #DECISION_MADE}    proposal passed contract enforcement</li>
 *   <li>{@link #SUBMITTED}        on-chain submission attempted</li>
 *   <li>{@link #PERSISTED}        decision handed to history-service</li>
 * </ol>
 *
 * <pre>
 *     .doOnEach(decisionFlowLogger.stage(DecisionFlowLogger.REPORTS_GATHERED))
 * </pre>
 */
@Component
public class DecisionFlowLogger {

    private static final Logger log = LoggerFactory.getLogger(DecisionFlowLogger.class);

    public static final String CYCLE_START      = "CYCLE_START";
    public static final String SAFETY_CHECK     = "SAFETY_CHECK";
    public static final String REPORTS_GATHERED = "REPORTS_GATHERED";
    public static final String DEBATE_DONE      = "DEBATE_DONE";
    public static final String RISK_VERDICT     = "RISK_VERDICT";
    public static final String DECISION_MADE    = "DECISION_MADE";
    public static final String SUBMITTED        = "SUBMITTED";
    public static final String PERSISTED        = "PERSISTED";

    /**
     * Returns a {@code doOnEach} consumer that logs the stage on {@code onNext} only.
     * The traceId comes from the Reactor Context and is bridged to MDC for the log call alone.
     */
    public <T> Consumer<Signal<T>> stage(String stageName) {
        return signal -> {
            if (!signal.isOnNext()) return;
            String traceId = TraceContextUtil.getTraceId(signal.getContextView());
            TraceContextUtil.withMdc(traceId, () ->
                log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
            );
        };
    }

    public void logWithTraceId(String stageName, String traceId) {
        TraceContextUtil.withMdc(traceId, () ->
            log.info("[DecisionFlow] stage={} traceId={}", stageName, traceId)
        );
    }

    /** One-line summary of a committed decision. */
    public void logDecision(Decision decision) {
        TraceContextUtil.withMdc(decision.traceId(), () ->
            log.info("[DecisionFlow] stage={} decisionId={} action={} confidence={} execution={} notes={} traceId={}",
                     DECISION_MADE, decision.decisionId(), decision.action(), decision.confidence(),
                     decision.executionStatus(), decision.notes().size(), decision.traceId())
        );
    }
}
