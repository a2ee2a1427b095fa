package com.yieldbasket.orchestrator.service;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.common.exception.DecisionContractViolationException;
import com.yieldbasket.common.exception.DecisionNotRecordedException;
import com.yieldbasket.common.model.Alert;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.common.model.CycleTriggerEvent;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ExecutionStatus;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import com.yieldbasket.common.model.RiskVerdict;
import com.yieldbasket.common.risk.RiskGate;
import com.yieldbasket.common.risk.RiskInput;
import com.yieldbasket.common.safety.GuardResult;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.common.trace.TraceContextUtil;
import com.yieldbasket.common.weights.WeightMath;
import com.yieldbasket.orchestrator.client.AlertClient;
import com.yieldbasket.orchestrator.client.BasketContractClient;
import com.yieldbasket.orchestrator.client.HistoryClient;
import com.yieldbasket.orchestrator.client.PortfolioStateClient;
import com.yieldbasket.orchestrator.debate.DebateContext;
import com.yieldbasket.orchestrator.debate.DebateCoordinator;
import com.yieldbasket.orchestrator.debate.DebateOutcome;
import com.yieldbasket.orchestrator.decision.DecisionContractEnforcer;
import com.yieldbasket.orchestrator.decision.DecisionInput;
import com.yieldbasket.orchestrator.decision.DecisionMaker;
import com.yieldbasket.orchestrator.decision.DecisionProposal;
import com.yieldbasket.orchestrator.fanout.FanOutResult;
import com.yieldbasket.orchestrator.fanout.ReportFanOutService;
import com.yieldbasket.orchestrator.logger.DecisionFlowLogger;
import com.yieldbasket.orchestrator.safety.SafetySystem;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Drives one decision cycle end to end.
 *
 * <p>Order: cycle lock, snapshot and safety check, parallel reports, degraded short-circuit,
 * debate, risk gate, decision maker with contract enforcement, optional submission,
 * persistence, lock release and a delayed reflection. Only one cycle runs at a time;
 * a second trigger fails fast with {@link CycleInProgressException}.
 *
 * <p>The history write is retried. A submitted decision that still cannot be recorded
 * engages the kill switch and fails the cycle with {@link DecisionNotRecordedException};
 * any other unrecorded decision raises a warning alert and the cycle completes.
 */
@Service
public class OrchestratorService {

    private static final Logger log = LoggerFactory.getLogger(OrchestratorService.class);

    static final String CYCLE_KEY  = "cycle";
    static final int    HINT_LIMIT = 10;
    static final String SOURCE     = "agent-orchestrator";

    private final PortfolioStateClient portfolioClient;
    private final HistoryClient historyClient;
    private final BasketContractClient basketContractClient;
    private final ReportFanOutService fanOutService;
    private final DebateCoordinator debateCoordinator;
    private final RiskGate riskGate;
    private final DecisionMaker decisionMaker;
    private final SafetySystem safetySystem;
    private final DecisionFlowLogger flowLogger;
    private final AlertClient alertClient;
    private final Clock clock;
    private final Duration cycleLockTtl;
    private final Duration reflectionDelay;
    private final int historyWindow;
    private final int persistRetries;
    private final Duration persistRetryBackoff;

    public OrchestratorService(PortfolioStateClient portfolioClient,
                               HistoryClient historyClient,
                               BasketContractClient basketContractClient,
                               ReportFanOutService fanOutService,
                               DebateCoordinator debateCoordinator,
                               RiskGate riskGate,
                               DecisionMaker decisionMaker,
                               SafetySystem safetySystem,
                               DecisionFlowLogger flowLogger,
                               AlertClient alertClient,
                               Clock clock,
                               @Value("${orchestrator.cycle-lock-ttl:PT10M}") Duration cycleLockTtl,
                               @Value("${orchestrator.reflection-delay:PT24H}") Duration reflectionDelay,
                               @Value("${orchestrator.history-window:30}") int historyWindow,
                               @Value("${orchestrator.persist-retries:3}") int persistRetries,
                               @Value("${orchestrator.persist-retry-backoff:PT0.5S}") Duration persistRetryBackoff) {
        this.portfolioClient      = portfolioClient;
        this.historyClient        = historyClient;
        this.basketContractClient = basketContractClient;
        this.fanOutService        = fanOutService;
        this.debateCoordinator    = debateCoordinator;
        this.riskGate             = riskGate;
        this.decisionMaker        = decisionMaker;
        this.safetySystem         = safetySystem;
        this.flowLogger           = flowLogger;
        this.alertClient          = alertClient;
        this.clock                = clock;
        this.cycleLockTtl         = cycleLockTtl;
        this.reflectionDelay      = reflectionDelay;
        this.historyWindow        = historyWindow;
        this.persistRetries       = persistRetries;
        this.persistRetryBackoff  = persistRetryBackoff;
    }

    public Mono<Decision> runCycle(CycleTriggerEvent event) {
        return Mono.defer(() -> {
            String traceId = event.traceId() != null ? event.traceId() : UUID.randomUUID().toString();
            Optional<IdempotencyGuard.Lease> lease = safetySystem.tryAcquire(CYCLE_KEY, cycleLockTtl);
            if (lease.isEmpty()) {
                log.warn("[Cycle] Rejected, another cycle holds the lock. reason={} traceId={}", event.reason(), traceId);
                return Mono.error(new CycleInProgressException(CYCLE_KEY));
            }
            log.info("[Cycle] Started. reason={} traceId={}", event.reason(), traceId);

            Mono<Decision> cycle = Mono.just(event)
                .doOnEach(flowLogger.stage(DecisionFlowLogger.CYCLE_START))
                .flatMap(e -> portfolioClient.snapshot(traceId))
                .flatMap(snapshot -> safetySystem.observeNav(snapshot.navUsd(), traceId).thenReturn(snapshot))
                .doOnEach(flowLogger.stage(DecisionFlowLogger.SAFETY_CHECK))
                .flatMap(snapshot -> safetySystem.mutationBlock()
                    .map(block -> Mono.just(skipped(event, traceId, snapshot, block)))
                    .orElseGet(() -> decide(event, traceId, snapshot)))
                .doOnNext(flowLogger::logDecision)
                .flatMap(this::persist)
                .doOnNext(this::scheduleReflection)
                .doFinally(signal -> safetySystem.release(lease.get()));

            return TraceContextUtil.withTraceId(cycle, traceId);
        });
    }

    // ── deliberation ────────────────────────────────────────────────────────

    private Mono<Decision> decide(CycleTriggerEvent event, String traceId, BasketSnapshot snapshot) {
        return Mono.zip(historyClient.calibrationHints(HINT_LIMIT), historyClient.recentDecisions(historyWindow))
            .flatMap(history -> {
                List<CalibrationHint> hints = history.getT1();
                List<Decision> recent = history.getT2();
                ReportRequest request = new ReportRequest(snapshot, hints, event.reason(), traceId);
                return fanOutService.gather(request)
                    .doOnEach(flowLogger.stage(DecisionFlowLogger.REPORTS_GATHERED))
                    .flatMap(fanOut -> fanOut.degraded()
                        ? Mono.just(degraded(event, traceId, snapshot, fanOut))
                        : deliberate(event, traceId, snapshot, fanOut, hints, recent));
            });
    }

    private Mono<Decision> deliberate(CycleTriggerEvent event, String traceId, BasketSnapshot snapshot,
                                      FanOutResult fanOut, List<CalibrationHint> hints, List<Decision> recent) {
        RecentActivity activity = RecentActivity.from(recent, clock.instant());
        DebateContext context = new DebateContext(traceId, event.reason(), snapshot, fanOut,
            riskGate.limits(), hints, recent, activity.rebalances());

        return debateCoordinator.debate(context)
            .doOnEach(flowLogger.stage(DecisionFlowLogger.DEBATE_DONE))
            .map(outcome -> {
                AnalystReport riskReport = fanOut.report(ProducerKind.RISK).orElse(null);
                RiskInput riskInput = new RiskInput(outcome.finalChange().targetWeights(), snapshot.weights(),
                    snapshot.navUsd(), snapshot.liquidityUsd(), activity.aggregateChange(), activity.rebalances(), riskReport);
                RiskVerdict verdict = riskGate.evaluate(outcome.finalChange().proposedAction(), riskInput);
                log.info("[DecisionFlow] stage={} approved={} violations={} softReason={} traceId={}",
                    DecisionFlowLogger.RISK_VERDICT, verdict.approved(), verdict.violations(), verdict.softReason(), traceId);

                DecisionProposal proposal = decisionMaker.decide(new DecisionInput(outcome, verdict, fanOut.reports(),
                    snapshot.weights(), snapshot.navUsd(), hints, recent));
                List<String> contractNotes = new ArrayList<>();
                try {
                    proposal = DecisionContractEnforcer.enforce(verdict, proposal);
                } catch (DecisionContractViolationException e) {
                    log.error("[Cycle] Decision maker contract violation, committing HOLD. proposed={} reason={} traceId={}",
                        e.getProposed(), e.getMessage(), traceId);
                    contractNotes.add("contract violation rejected: " + e.getMessage());
                    proposal = DecisionProposal.hold(outcome.finalHold().confidence(), "HOLD committed after rejected proposal");
                }
                return assemble(event, traceId, snapshot, fanOut, outcome, verdict, proposal, contractNotes);
            })
            .flatMap(decision -> execute(decision, activity));
    }

    private Decision assemble(CycleTriggerEvent event, String traceId, BasketSnapshot snapshot, FanOutResult fanOut,
                              DebateOutcome outcome, RiskVerdict verdict, DecisionProposal proposal,
                              List<String> contractNotes) {
        List<String> notes = new ArrayList<>(fanOut.errorNotes());
        notes.add("debate: " + outcome.rounds() + " round(s), converged=" + outcome.converged());
        outcome.rejections().forEach(r -> notes.add("debate rejection: " + r));
        verdict.violations().forEach(v -> notes.add("violation: " + v));
        if (!verdict.approved() && verdict.softReason() != null) notes.add("soft veto: " + verdict.softReason());
        notes.addAll(contractNotes);
        notes.addAll(proposal.notes());

        Map<String, Double> finalWeights = proposal.action() == DecisionAction.REBALANCE
            ? proposal.targetWeights()
            : committedCurrent(snapshot);
        return new Decision(UUID.randomUUID().toString(), traceId, event.reason(), proposal.action(),
            snapshot.weights(), finalWeights, proposal.confidence(), proposal.feeCostRatio(),
            fanOut.reports(), outcome.theses(), verdict, ExecutionStatus.NOT_REQUIRED, null, notes,
            snapshot.navUsd(), snapshot.latestPrices(), clock.instant());
    }

    private Decision degraded(CycleTriggerEvent event, String traceId, BasketSnapshot snapshot, FanOutResult fanOut) {
        List<String> notes = new ArrayList<>();
        notes.add("degraded mode: " + fanOut.failedCount() + " agents failed");
        notes.addAll(fanOut.errorNotes());
        log.warn("[Cycle] Degraded HOLD, debate skipped. failed={} traceId={}", fanOut.failedCount(), traceId);
        return new Decision(UUID.randomUUID().toString(), traceId, event.reason(), DecisionAction.HOLD,
            snapshot.weights(), committedCurrent(snapshot), 0.0, 0.0, fanOut.reports(), List.of(), null,
            ExecutionStatus.NOT_REQUIRED, null, notes, snapshot.navUsd(), snapshot.latestPrices(), clock.instant());
    }

    private Decision skipped(CycleTriggerEvent event, String traceId, BasketSnapshot snapshot, String reason) {
        log.warn("[Cycle] Skipped by safety system. reason={} traceId={}", reason, traceId);
        return new Decision(UUID.randomUUID().toString(), traceId, event.reason(), DecisionAction.SKIPPED,
            snapshot.weights(), committedCurrent(snapshot), 0.0, 0.0, List.of(), List.of(), null,
            ExecutionStatus.NOT_REQUIRED, null, List.of(reason), snapshot.navUsd(), snapshot.latestPrices(),
            clock.instant());
    }

    // ── execution ───────────────────────────────────────────────────────────

    private Mono<Decision> execute(Decision decision, RecentActivity activity) {
        if (decision.action() != DecisionAction.REBALANCE && decision.action() != DecisionAction.EMERGENCY_EXIT) {
            return Mono.just(decision);
        }
        Optional<String> block = safetySystem.mutationBlock();
        if (block.isPresent()) {
            return Mono.just(decision.withExecution(ExecutionStatus.BLOCKED, null, block.get()));
        }
        Optional<IdempotencyGuard.Lease> lease = safetySystem.tryAcquire("submit:" + decision.decisionId(), cycleLockTtl);
        if (lease.isEmpty()) {
            return Mono.just(decision.withExecution(ExecutionStatus.BLOCKED, null, "submission already in progress"));
        }

        Mono<Decision> submission = decision.action() == DecisionAction.EMERGENCY_EXIT
            ? basketContractClient.submitEmergencyExit(decision.decisionId(), decision.traceId())
                .map(tx -> decision.withExecution(ExecutionStatus.SUBMITTED, tx, "emergency exit submitted"))
            : portfolioClient.snapshot(decision.traceId())
                .flatMap(fresh -> {
                    GuardResult guard = safetySystem.checkExecution(new RiskInput(decision.finalWeights(),
                        fresh.weights(), fresh.navUsd(), fresh.liquidityUsd(),
                        activity.aggregateChange(), activity.rebalances(), null));
                    if (!guard.allowed()) {
                        log.warn("[Cycle] Portfolio guard blocked submission. reason={} traceId={}",
                            guard.reason(), decision.traceId());
                        return Mono.just(decision.withExecution(ExecutionStatus.BLOCKED, null, guard.reason()));
                    }
                    return basketContractClient.submitRebalance(decision.decisionId(), decision.finalWeights(), decision.traceId())
                        .map(tx -> decision.withExecution(ExecutionStatus.SUBMITTED, tx, "rebalance submitted"));
                });

        return submission
            .doOnNext(d -> flowLogger.logWithTraceId(DecisionFlowLogger.SUBMITTED, d.traceId()))
            .onErrorResume(e -> {
                log.error("[Cycle] Submission failed. decisionId={} reason={} traceId={}",
                    decision.decisionId(), e.getMessage(), decision.traceId());
                return Mono.just(decision.withExecution(ExecutionStatus.SUBMISSION_FAILED, null,
                    "submission failed: " + e.getMessage()));
            })
            .doFinally(signal -> safetySystem.release(lease.get()));
    }

    // ── persistence and follow-up ───────────────────────────────────────────

    private Mono<Decision> persist(Decision decision) {
        return Mono.defer(() -> historyClient.save(decision))
            .retryWhen(Retry.backoff(persistRetries, persistRetryBackoff)
                .doBeforeRetry(signal -> log.warn("[Cycle] History save failed, retrying. attempt={} decisionId={} reason={}",
                    signal.totalRetries() + 1, decision.decisionId(), signal.failure().getMessage())))
            .doOnSuccess(saved -> flowLogger.logWithTraceId(DecisionFlowLogger.PERSISTED, decision.traceId()))
            .thenReturn(decision)
            .onErrorResume(e -> unrecorded(decision, e));
    }

    private Mono<Decision> unrecorded(Decision decision, Throwable error) {
        Throwable cause = error.getCause() != null ? error.getCause() : error;
        String detail = "decision " + decision.decisionId() + " (" + decision.action() + ", "
            + decision.executionStatus() + ") not recorded after " + (persistRetries + 1)
            + " attempts: " + cause.getMessage();
        if (decision.executionStatus() != ExecutionStatus.SUBMITTED) {
            log.error("[Cycle] {} traceId={}", detail, decision.traceId());
            alertClient.send(Alert.warning(SOURCE, "Decision not recorded", detail, decision.traceId()));
            return Mono.just(decision);
        }
        String fullDetail = detail + "; on-chain tx " + decision.txReference();
        log.error("[Cycle] Submitted {} traceId={}", fullDetail, decision.traceId());
        alertClient.send(Alert.critical(SOURCE, "Submitted decision not recorded", fullDetail, decision.traceId()));
        DecisionNotRecordedException failure = new DecisionNotRecordedException(decision.decisionId(), fullDetail, cause);
        return safetySystem.engageKillSwitch("unrecorded submission " + decision.decisionId()
                + " tx " + decision.txReference())
            .onErrorResume(e -> {
                failure.addSuppressed(e);
                return Mono.empty();
            })
            .then(Mono.<Decision>error(failure));
    }

    private void scheduleReflection(Decision decision) {
        if (decision.action() == DecisionAction.SKIPPED) return;
        Mono.delay(reflectionDelay)
            .then(Mono.defer(() -> historyClient.reflect(decision.decisionId())))
            .subscribe(
                hint -> log.info("[Reflection] Completed. decisionId={} note={}", decision.decisionId(), hint.note()),
                err  -> log.warn("[Reflection] Scheduled run failed (non-critical). decisionId={}",
                                 decision.decisionId(), err)
            );
    }

    private static Map<String, Double> committedCurrent(BasketSnapshot snapshot) {
        return snapshot.weights().isEmpty() ? Map.of() : WeightMath.normalize(snapshot.weights());
    }
}
