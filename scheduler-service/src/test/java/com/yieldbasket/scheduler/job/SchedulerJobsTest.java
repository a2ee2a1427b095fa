package com.yieldbasket.scheduler.job;

import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.scheduler.client.HistoryClient;
import com.yieldbasket.scheduler.client.OrchestratorClient;
import com.yieldbasket.scheduler.client.SettlementClient;
import com.yieldbasket.scheduler.model.CycleOutcome;
import com.yieldbasket.scheduler.model.SettlementSweep;
import com.yieldbasket.scheduler.model.StepSummary;
import com.yieldbasket.scheduler.model.TriggerSummary;
import com.yieldbasket.scheduler.support.TestProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;
import reactor.test.scheduler.VirtualTimeScheduler;

import java.time.Duration;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SchedulerJobsTest {

    @Mock OrchestratorClient orchestratorClient;
    @Mock HistoryClient      historyClient;
    @Mock SettlementClient   settlementClient;

    private VirtualTimeScheduler vts;

    @BeforeEach
    void setUp() {
        vts = VirtualTimeScheduler.create();
    }

    @AfterEach
    void tearDown() {
        vts.dispose();
    }

    private static Decision hold() {
        return new Decision("d-1", "t-1", TriggerReason.SCHEDULED, DecisionAction.HOLD, null, null,
            0.6, 0.0, null, null, null, null, null, null, 100_000.0, null, null);
    }

    @Nested
    @DisplayName("decision cycle")
    class DecisionCycle {

        @Test
        void triggersScheduledCyclesAtConfiguredInterval() {
            when(orchestratorClient.triggerCycle(TriggerReason.SCHEDULED))
                .thenReturn(Mono.just(CycleOutcome.completed(hold())));
            DecisionCycleJob job = new DecisionCycleJob(orchestratorClient, TestProperties.defaults(), vts);

            job.start();
            vts.advanceTimeBy(Duration.ofSeconds(30));
            verify(orchestratorClient, times(1)).triggerCycle(TriggerReason.SCHEDULED);

            vts.advanceTimeBy(Duration.ofHours(2));
            verify(orchestratorClient, times(3)).triggerCycle(TriggerReason.SCHEDULED);
            job.stop();
        }

        @Test
        void failedCycleRetriesAfterBackoff() {
            when(orchestratorClient.triggerCycle(TriggerReason.SCHEDULED))
                .thenReturn(Mono.just(CycleOutcome.failed("connection refused")));
            DecisionCycleJob job = new DecisionCycleJob(orchestratorClient, TestProperties.defaults(), vts);

            StepVerifier.create(job.runOnce()).expectNext(Duration.ofMinutes(5)).verifyComplete();
        }

        @Test
        void disabledSchedulerDoesNotStart() {
            DecisionCycleJob job = new DecisionCycleJob(orchestratorClient, TestProperties.withEnabled(false), vts);

            job.start();
            vts.advanceTimeBy(Duration.ofDays(1));

            assertFalse(job.loop().isRunning());
            verifyNoInteractions(orchestratorClient);
        }
    }

    @Nested
    @DisplayName("reflection")
    class Reflection {

        @Test
        void successfulSweepWaitsFullInterval() {
            when(historyClient.runReflectionSweep()).thenReturn(Mono.just(3));
            ReflectionJob job = new ReflectionJob(historyClient, TestProperties.defaults(), vts);

            StepVerifier.create(job.runOnce()).expectNext(Duration.ofHours(6)).verifyComplete();
        }

        @Test
        void failedSweepRetriesSooner() {
            when(historyClient.runReflectionSweep()).thenReturn(Mono.empty());
            ReflectionJob job = new ReflectionJob(historyClient, TestProperties.defaults(), vts);

            StepVerifier.create(job.runOnce()).expectNext(Duration.ofMinutes(5)).verifyComplete();
        }
    }

    @Nested
    @DisplayName("settlement")
    class Settlement {

        @Test
        void inFlightJobSpeedsUpNextTick() {
            when(settlementClient.sweep()).thenReturn(Mono.just(new SettlementSweep(
                new TriggerSummary(false, null, 0L, "job 4 still in flight at ATTESTATION_PENDING"),
                List.of(new StepSummary(4, "SOURCE_CONFIRMED", "ATTESTATION_PENDING", true, null)),
                true)));
            SettlementJob job = new SettlementJob(settlementClient, TestProperties.defaults(), vts);

            StepVerifier.create(job.runOnce()).expectNext(Duration.ofMinutes(2)).verifyComplete();
        }

        @Test
        void loopKeepsRunningWhenSweepErrors() {
            when(settlementClient.sweep())
                .thenReturn(Mono.error(new IllegalStateException("unexpected")))
                .thenReturn(Mono.just(new SettlementSweep(
                    new TriggerSummary(false, null, 0L, "below threshold"), List.of(), true)));
            SettlementJob job = new SettlementJob(settlementClient, TestProperties.defaults(), vts);

            job.start();
            vts.advanceTimeBy(Duration.ofSeconds(30));
            vts.advanceTimeBy(Duration.ofMinutes(5));

            verify(settlementClient, times(2)).sweep();
            assertEquals(Duration.ofHours(1), job.loop().lastInterval());
            job.stop();
        }
    }
}
