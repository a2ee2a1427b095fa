package com.yieldbasket.orchestrator.service;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.common.exception.DecisionNotRecordedException;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.CycleTriggerEvent;
import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ExecutionStatus;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.common.risk.RebalanceFrequencyJudge;
import com.yieldbasket.common.risk.RiskGate;
import com.yieldbasket.common.risk.RiskLimits;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.common.safety.KillSwitch;
import com.yieldbasket.common.safety.LossHaltGuard;
import com.yieldbasket.common.safety.PortfolioGuard;
import com.yieldbasket.common.weights.WeightMath;
import com.yieldbasket.orchestrator.client.AlertClient;
import com.yieldbasket.orchestrator.client.BasketContractClient;
import com.yieldbasket.orchestrator.client.HistoryClient;
import com.yieldbasket.orchestrator.client.PortfolioStateClient;
import com.yieldbasket.orchestrator.client.ReportProducerClient;
import com.yieldbasket.orchestrator.config.DebateProperties;
import com.yieldbasket.orchestrator.debate.DebateAdvocate;
import com.yieldbasket.orchestrator.debate.DebateCoordinator;
import com.yieldbasket.orchestrator.debate.RuleBasedAdvocate;
import com.yieldbasket.orchestrator.decision.DecisionMaker;
import com.yieldbasket.orchestrator.decision.DecisionProposal;
import com.yieldbasket.orchestrator.decision.DefaultDecisionMaker;
import com.yieldbasket.orchestrator.decision.FeeEstimator;
import com.yieldbasket.orchestrator.fanout.ReportFanOutService;
import com.yieldbasket.orchestrator.logger.DecisionFlowLogger;
import com.yieldbasket.orchestrator.safety.SafetySystem;
import com.yieldbasket.orchestrator.support.Fixtures;
import com.yieldbasket.orchestrator.support.InMemorySafetyFlags;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class OrchestratorServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

    @Mock private ReportProducerClient producerClient;
    @Mock private HistoryClient historyClient;
    @Mock private PortfolioStateClient portfolioClient;
    @Mock private BasketContractClient basketContractClient;
    @Mock private AlertClient alertClient;

    private final AtomicReference<BasketSnapshot> snapshot = new AtomicReference<>(Fixtures.snapshot(1_000_000));
    private final RiskLimits limits = RiskLimits.defaults();
    private final InMemorySafetyFlags flags = new InMemorySafetyFlags();
    private IdempotencyGuard idempotencyGuard;
    private SafetySystem safetySystem;

    @BeforeEach
    void setUp() {
        idempotencyGuard = new IdempotencyGuard(CLOCK);
        safetySystem = safetySystem();

        lenient().when(portfolioClient.snapshot(anyString())).thenAnswer(inv -> Mono.just(snapshot.get()));
        lenient().when(historyClient.calibrationHints(anyInt())).thenReturn(Mono.just(List.of()));
        lenient().when(historyClient.recentDecisions(anyInt())).thenReturn(Mono.just(List.of()));
        lenient().when(historyClient.save(any())).thenAnswer(inv -> Mono.just(inv.getArgument(0)));
        lenient().when(basketContractClient.submitRebalance(anyString(), anyMap(), anyString())).thenReturn(Mono.just("tx-1"));
        lenient().when(basketContractClient.submitEmergencyExit(anyString(), anyString())).thenReturn(Mono.just("tx-exit"));
        reports(Fixtures.allBullish());
    }

    private SafetySystem safetySystem() {
        return new SafetySystem(new KillSwitch(), new LossHaltGuard(CLOCK, 0.15, Duration.ofHours(24)),
            new PortfolioGuard(limits), idempotencyGuard, alertClient, flags.repository, CLOCK, Duration.ofSeconds(5));
    }

    private void reports(List<AnalystReport> reports) {
        reports.forEach(r -> lenient().when(producerClient.produce(eq(r.producer()), any())).thenReturn(Mono.just(r)));
    }

    private OrchestratorService service(DebateAdvocate advocate, DecisionMaker decisionMaker) {
        return new OrchestratorService(portfolioClient, historyClient, basketContractClient,
            new ReportFanOutService(producerClient, 200),
            new DebateCoordinator(advocate, new DebateProperties(3, 0.15, 1_000, 2)),
            new RiskGate(limits, new RebalanceFrequencyJudge()),
            decisionMaker, safetySystem, new DecisionFlowLogger(), alertClient, CLOCK,
            Duration.ofMinutes(10), Duration.ofDays(365), 30, 2, Duration.ofMillis(1));
    }

    private OrchestratorService service() {
        return service(new RuleBasedAdvocate(), defaultMaker());
    }

    private static DefaultDecisionMaker defaultMaker() {
        return new DefaultDecisionMaker(new FeeEstimator(5.0, 30), 1.0, 0.10);
    }

    private static CycleTriggerEvent trigger() {
        return new CycleTriggerEvent(TriggerReason.SCHEDULED, CLOCK.instant(), "trace-1");
    }

    /** Change side proposes SOL at 35%, hold side agrees closely enough to converge. */
    private static final DebateAdvocate OVERWEIGHT_SOL = (position, context, transcript, round, correction) ->
        Mono.just(position == DebatePosition.ADVOCATE_FOR_CHANGE
            ? new DebateThesis(position, DecisionAction.REBALANCE,
                Map.of("USDC", 0.10, "SOL", 0.35, "ETH", 0.25, "BTC", 0.30), 0.95, List.of("SOL breakout"), round)
            : new DebateThesis(position, DecisionAction.HOLD, Map.of(), 0.85, List.of("concentration"), round));

    @Nested
    @DisplayName("scenario A: healthy cycle")
    class HealthyCycle {

        @Test
        @DisplayName("four bullish reports converge in one round and submit the change thesis weights")
        void rebalanceSubmitted() {
            StepVerifier.create(service().runCycle(trigger()))
                .assertNext(decision -> {
                    assertEquals(DecisionAction.REBALANCE, decision.action());
                    assertThat(decision.theses()).hasSize(2);
                    DebateThesis change = decision.theses().get(0);
                    assertEquals(change.targetWeights(), decision.finalWeights());
                    assertTrue(WeightMath.sumsToOne(decision.finalWeights(), 1e-6));
                    assertThat(decision.finalWeights().values()).allMatch(w -> w <= 0.30 + 1e-9);
                    assertTrue(decision.verdict().approved());
                    assertEquals(ExecutionStatus.SUBMITTED, decision.executionStatus());
                    assertEquals("tx-1", decision.txReference());
                    assertThat(decision.notes()).contains("debate: 1 round(s), converged=true");
                })
                .verifyComplete();

            verify(historyClient).save(any(Decision.class));
            assertFalse(idempotencyGuard.isHeld(OrchestratorService.CYCLE_KEY));
        }
    }

    @Nested
    @DisplayName("scenario B: risk veto")
    class RiskVeto {

        @Test
        @DisplayName("a 35% token is vetoed and the decision is HOLD")
        void overweightVetoed() {
            StepVerifier.create(service(OVERWEIGHT_SOL, defaultMaker()).runCycle(trigger()))
                .assertNext(decision -> {
                    assertEquals(DecisionAction.HOLD, decision.action());
                    assertFalse(decision.verdict().approved());
                    assertThat(decision.verdict().violations()).containsExactly("token SOL weight 0.35 exceeds 0.30 limit");
                    assertThat(decision.notes()).contains("violation: token SOL weight 0.35 exceeds 0.30 limit");
                    assertEquals(ExecutionStatus.NOT_REQUIRED, decision.executionStatus());
                })
                .verifyComplete();

            verifyNoInteractions(basketContractClient);
        }

        @Test
        @DisplayName("a decision maker that ignores the veto is overridden with HOLD")
        void contractViolationCommitsHold() {
            DecisionMaker reckless = input -> new DecisionProposal(DecisionAction.REBALANCE,
                input.debate().finalChange().targetWeights(), 0.95, 0.0, List.of());

            StepVerifier.create(service(OVERWEIGHT_SOL, reckless).runCycle(trigger()))
                .assertNext(decision -> {
                    assertEquals(DecisionAction.HOLD, decision.action());
                    assertThat(decision.notes()).anyMatch(n -> n.startsWith("contract violation rejected: "));
                })
                .verifyComplete();

            verifyNoInteractions(basketContractClient);
        }
    }

    @Nested
    @DisplayName("scenario C: degraded mode")
    class Degraded {

        @Test
        @DisplayName("two producer timeouts skip the debate and commit HOLD")
        void twoTimeoutsHold() {
            lenient().when(producerClient.produce(eq(ProducerKind.TREND), any())).thenReturn(Mono.never());
            lenient().when(producerClient.produce(eq(ProducerKind.SENTIMENT), any())).thenReturn(Mono.never());
            AtomicInteger advocateCalls = new AtomicInteger();
            DebateAdvocate counting = (position, context, transcript, round, correction) -> {
                advocateCalls.incrementAndGet();
                return new RuleBasedAdvocate().argue(position, context, transcript, round, correction);
            };

            StepVerifier.create(service(counting, defaultMaker()).runCycle(trigger()))
                .assertNext(decision -> {
                    assertEquals(DecisionAction.HOLD, decision.action());
                    assertThat(decision.notes().get(0)).isEqualTo("degraded mode: 2 agents failed");
                    assertThat(decision.theses()).isEmpty();
                    assertNull(decision.verdict());
                    assertThat(decision.reports()).filteredOn(AnalystReport::isError).hasSize(2);
                })
                .verifyComplete();

            assertEquals(0, advocateCalls.get());
        }

        @Test
        @DisplayName("a single failed producer still debates")
        void oneFailureStillDebates() {
            lenient().when(producerClient.produce(eq(ProducerKind.SENTIMENT), any()))
                .thenReturn(Mono.error(new IllegalStateException("feed down")));

            StepVerifier.create(service().runCycle(trigger()))
                .assertNext(decision -> {
                    assertThat(decision.theses()).isNotEmpty();
                    assertThat(decision.notes()).anyMatch(n -> n.startsWith("producer SENTIMENT failed"));
                })
                .verifyComplete();
        }
    }

    @Nested
    @DisplayName("scenario E: safety halts")
    class SafetyHalts {

        @Test
        @DisplayName("a 16% NAV drop skips cycles until an operator clears the halt")
        void lossHaltSkipsUntilCleared() {
            OrchestratorService service = service();
            StepVerifier.create(service.runCycle(trigger()))
                .assertNext(d -> assertEquals(DecisionAction.REBALANCE, d.action()))
                .verifyComplete();

            snapshot.set(Fixtures.snapshot(840_000));
            StepVerifier.create(service.runCycle(trigger()))
                .assertNext(d -> {
                    assertEquals(DecisionAction.SKIPPED, d.action());
                    assertThat(d.notes().get(0)).startsWith("loss halt");
                    assertThat(d.reports()).isEmpty();
                })
                .verifyComplete();
            StepVerifier.create(service.runCycle(trigger()))
                .assertNext(d -> assertEquals(DecisionAction.SKIPPED, d.action()))
                .verifyComplete();

            safetySystem.clearLossHalt().block();
            StepVerifier.create(service.runCycle(trigger()))
                .assertNext(d -> assertNotEquals(DecisionAction.SKIPPED, d.action()))
                .verifyComplete();
        }

        @Test
        @DisplayName("an engaged kill switch skips the cycle without contacting producers")
        void killSwitchSkips() {
            safetySystem.engageKillSwitch("operator drill").block();

            StepVerifier.create(service().runCycle(trigger()))
                .assertNext(d -> {
                    assertEquals(DecisionAction.SKIPPED, d.action());
                    assertThat(d.notes().get(0)).contains("operator drill");
                })
                .verifyComplete();

            verifyNoInteractions(producerClient, basketContractClient);
        }

        @Test
        @DisplayName("a second trigger while a cycle holds the lock fails fast")
        void concurrentCycleRejected() {
            idempotencyGuard.tryAcquire(OrchestratorService.CYCLE_KEY, Duration.ofMinutes(10));

            StepVerifier.create(service().runCycle(trigger()))
                .expectErrorSatisfies(e -> assertThat(e)
                    .isInstanceOf(CycleInProgressException.class)
                    .hasMessage("operation already in progress: cycle"))
                .verify();
        }

        @Test
        @DisplayName("a loss halt set before a restart still skips the next cycle")
        void lossHaltSurvivesRestart() {
            service().runCycle(trigger()).block();
            snapshot.set(Fixtures.snapshot(840_000));
            StepVerifier.create(service().runCycle(trigger()))
                .assertNext(d -> assertEquals(DecisionAction.SKIPPED, d.action()))
                .verifyComplete();

            safetySystem = safetySystem();
            safetySystem.restore().block();
            snapshot.set(Fixtures.snapshot(1_000_000));

            StepVerifier.create(service().runCycle(trigger()))
                .assertNext(d -> {
                    assertEquals(DecisionAction.SKIPPED, d.action());
                    assertThat(d.notes().get(0)).startsWith("loss halt: NAV dropped 16.00%");
                })
                .verifyComplete();
            verify(producerClient, times(4)).produce(any(), any());
        }
    }

    @Nested
    @DisplayName("decision record")
    class DecisionRecording {

        @Test
        @DisplayName("a transient history failure is retried and the decision is recorded")
        void transientFailureRetried() {
            AtomicInteger attempts = new AtomicInteger();
            lenient().when(historyClient.save(any())).thenAnswer(inv -> attempts.incrementAndGet() < 3
                ? Mono.error(new IllegalStateException("history down"))
                : Mono.just(inv.getArgument(0)));

            StepVerifier.create(service().runCycle(trigger()))
                .assertNext(d -> assertEquals(ExecutionStatus.SUBMITTED, d.executionStatus()))
                .verifyComplete();

            assertEquals(3, attempts.get());
            assertFalse(safetySystem.status().killSwitchEngaged());
        }

        @Test
        @DisplayName("a submitted rebalance that cannot be recorded fails the cycle and engages the kill switch")
        void submittedButUnrecorded() {
            lenient().when(historyClient.save(any())).thenReturn(Mono.error(new IllegalStateException("history down")));

            StepVerifier.create(service().runCycle(trigger()))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(DecisionNotRecordedException.class, e);
                    assertThat(e.getMessage()).contains("not recorded after 3 attempts: history down")
                        .endsWith("on-chain tx tx-1");
                })
                .verify();

            verify(historyClient, times(3)).save(any());
            verify(alertClient).send(argThat(a -> a.title().equals("Submitted decision not recorded")));
            assertTrue(safetySystem.status().killSwitchEngaged());
            assertThat(safetySystem.mutationBlock().orElseThrow()).contains("unrecorded submission");
            assertThat(flags.rows(KillSwitch.NAME)).hasSize(1);
        }

        @Test
        @DisplayName("an unrecorded HOLD raises a warning and the cycle completes")
        void unrecordedHoldCompletes() {
            lenient().when(historyClient.save(any())).thenReturn(Mono.error(new IllegalStateException("history down")));

            StepVerifier.create(service(OVERWEIGHT_SOL, defaultMaker()).runCycle(trigger()))
                .assertNext(d -> assertEquals(DecisionAction.HOLD, d.action()))
                .verifyComplete();

            verify(alertClient).send(argThat(a -> a.title().equals("Decision not recorded")));
            assertFalse(safetySystem.status().killSwitchEngaged());
        }
    }
}
