package com.yieldbasket.settlement.service;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.common.model.RewardDepositRequest;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.settlement.client.AlertClient;
import com.yieldbasket.settlement.config.SettlementProperties;
import com.yieldbasket.settlement.exception.BridgeJobNotFoundException;
import com.yieldbasket.settlement.exception.InvalidJobStateException;
import com.yieldbasket.settlement.gateway.DryRunChainSimulator;
import com.yieldbasket.settlement.model.BridgeEvent;
import com.yieldbasket.settlement.model.BridgeJob;
import com.yieldbasket.settlement.model.BridgeState;
import com.yieldbasket.settlement.model.StepResult;
import com.yieldbasket.settlement.support.InMemoryBridgeStore;
import com.yieldbasket.settlement.support.RecordingRewardPool;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import reactor.core.publisher.Mono;
import reactor.test.StepVerifier;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class BridgeStateMachineTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
    private static final long AMOUNT = 2_500_000_000L;

    private static final SettlementProperties PROPS = new SettlementProperties(
        Duration.ofSeconds(15), Duration.ofMinutes(30), Duration.ofSeconds(5), Duration.ofMinutes(2),
        3, Duration.ofMinutes(40));

    /** Everything that survives a process restart: the database, both chains, the reward pool. */
    private static final class World {
        final InMemoryBridgeStore store = new InMemoryBridgeStore();
        final DryRunChainSimulator chain;
        final RecordingRewardPool rewardPool = new RecordingRewardPool();
        final AlertClient alertClient = mock(AlertClient.class);

        World(int attestationPendingPolls) {
            chain = spy(new DryRunChainSimulator(0L, 0.1, attestationPendingPolls));
        }

        /** A fresh process: new machine, new in-memory lease table, same durable state. */
        BridgeStateMachine process() {
            return new BridgeStateMachine(store.jobRepository,
                new BridgeEventLog(store.eventRepository, CLOCK),
                chain, chain, chain, rewardPool, alertClient, new IdempotencyGuard(CLOCK), PROPS, CLOCK);
        }
    }

    private World world;
    private BridgeStateMachine machine;

    @BeforeEach
    void setUp() {
        world = new World(0);
        machine = world.process();
    }

    private long newJob(BridgeStateMachine m) {
        return m.create(AMOUNT, "THRESHOLD").block().getId();
    }

    private static void advanceTimes(BridgeStateMachine m, long jobId, int steps) {
        for (int i = 0; i < steps; i++) {
            m.advance(jobId).block();
        }
    }

    private static List<Object> artifacts(BridgeJob job) {
        return List.of(job.getLockRef(), job.getMessageHash(), job.getAttestation(),
            job.getMintRef(), job.getDepositRef(), job.getNetDepositedRaw());
    }

    @Nested
    @DisplayName("Happy path")
    class HappyPath {

        @Test
        void resumeDrivesNewJobToDeposited() {
            long id = newJob(machine);

            StepVerifier.create(machine.resume(id))
                .assertNext(job -> {
                    assertEquals(BridgeState.DEPOSITED, job.getState());
                    assertThat(job.getLockRef()).startsWith("lock-");
                    assertThat(job.getMessageHash()).startsWith("0x");
                    assertNotNull(job.getAttestation());
                    assertThat(job.getMintRef()).startsWith("mint-");
                    assertEquals("bridge-" + id, job.getDepositRef());
                    assertEquals(AMOUNT - 3, job.getNetDepositedRaw());
                })
                .verifyComplete();

            List<String> transitions = world.store.events(id).stream()
                .map(BridgeEvent::getToState).collect(Collectors.toList());
            assertThat(transitions).containsExactly("READY", "SOURCE_LOCKED", "SOURCE_CONFIRMED",
                "ATTESTATION_PENDING", "ATTESTATION_RECEIVED", "DEST_MINTED", "DEPOSITED");
        }

        @Test
        void advanceMovesExactlyOneStateAndPersistsTheArtifact() {
            long id = newJob(machine);

            StepVerifier.create(machine.advance(id))
                .assertNext(result -> {
                    assertEquals(BridgeState.READY, result.fromState());
                    assertEquals(BridgeState.SOURCE_LOCKED, result.toState());
                    assertTrue(result.success());
                })
                .verifyComplete();

            BridgeJob row = world.store.row(id);
            assertEquals(BridgeState.SOURCE_LOCKED, row.getState());
            assertNotNull(row.getLockRef());
            assertNull(row.getMessageHash());
        }

        @Test
        void advanceOnTerminalJobReportsItUnchanged() {
            long id = newJob(machine);
            machine.resume(id).block();

            StepResult result = machine.advance(id).block();

            assertEquals(BridgeState.DEPOSITED, result.fromState());
            assertEquals(BridgeState.DEPOSITED, result.toState());
            assertTrue(result.success());
            assertEquals(1, world.rewardPool.calls());
        }

        @Test
        void unknownJobIsNotFound() {
            StepVerifier.create(machine.advance(99))
                .expectError(BridgeJobNotFoundException.class)
                .verify();
        }

        @Test
        void nonPositiveAmountIsRejected() {
            StepVerifier.create(machine.create(0, "MANUAL"))
                .expectError(IllegalArgumentException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("Resume after restart")
    class Resume {

        @Test
        @DisplayName("attestation already received: resume mints without touching the source chain again")
        void resumeFromAttestationReceivedSkipsLock() {
            long id = newJob(machine);
            advanceTimes(machine, id, 4);
            assertEquals(BridgeState.ATTESTATION_RECEIVED, world.store.row(id).getState());

            BridgeStateMachine restarted = world.process();
            BridgeJob done = restarted.resume(id).block();

            assertEquals(BridgeState.DEPOSITED, done.getState());
            verify(world.chain, times(1)).submitLock(eq(id), anyLong());
            verify(world.chain, times(1)).confirmation(anyString());
            verify(world.chain, times(1)).submitMint(anyString(), anyString());

            BridgeEvent firstAfterRestart = world.store.events(id).get(5);
            assertEquals("ATTESTATION_RECEIVED", firstAfterRestart.getFromState());
            assertEquals("DEST_MINTED", firstAfterRestart.getToState());
        }

        @ParameterizedTest(name = "crash after {0} step(s)")
        @ValueSource(ints = {0, 1, 2, 3, 4, 5})
        void crashAfterAnyStateYieldsSameTerminalArtifacts(int stepsBeforeCrash) {
            World reference = new World(0);
            BridgeStateMachine uninterrupted = reference.process();
            BridgeJob expected = uninterrupted.resume(newJob(uninterrupted)).block();

            long id = newJob(machine);
            advanceTimes(machine, id, stepsBeforeCrash);
            BridgeJob resumed = world.process().resume(id).block();

            assertEquals(BridgeState.DEPOSITED, resumed.getState());
            assertEquals(artifacts(expected), artifacts(resumed));
            verify(world.chain, times(1)).submitLock(eq(id), anyLong());
            verify(world.chain, times(1)).submitMint(anyString(), anyString());
            assertEquals(1, world.rewardPool.deposits());
        }

        @Test
        @DisplayName("lock submitted but not persisted: the retried step reuses the on-chain lock")
        void lockLandedBeforeCrashIsReused() {
            long id = newJob(machine);
            String landed = world.chain.submitLock(id, AMOUNT).block();

            BridgeStateMachine restarted = world.process();
            StepResult result = restarted.advance(id).block();

            assertEquals(BridgeState.SOURCE_LOCKED, result.toState());
            assertEquals(landed, world.store.row(id).getLockRef());
            verify(world.chain, times(1)).submitLock(anyLong(), anyLong());
        }

        @Test
        @DisplayName("mint submitted but not persisted: the retried step reuses the mint")
        void mintLandedBeforeCrashIsReused() {
            long id = newJob(machine);
            advanceTimes(machine, id, 4);
            BridgeJob row = world.store.row(id);
            String landed = world.chain.submitMint(row.getMessageHash(), row.getAttestation()).block();

            world.process().advance(id).block();

            assertEquals(landed, world.store.row(id).getMintRef());
            verify(world.chain, times(1)).submitMint(anyString(), anyString());
        }

        @Test
        void depositAlreadyMadeReturnsOriginalReceipt() {
            long id = newJob(machine);
            advanceTimes(machine, id, 5);
            world.rewardPool.deposit(new RewardDepositRequest("bridge-" + id, AMOUNT)).block();

            BridgeJob done = world.process().resume(id).block();

            assertEquals(BridgeState.DEPOSITED, done.getState());
            assertEquals(1, world.rewardPool.deposits());
            assertThat(world.store.events(id).get(6).getDetail()).contains("already deposited");
        }
    }

    @Nested
    @DisplayName("Attestation poll")
    class AttestationPoll {

        @Test
        void pendingAttestationIsPolledAtFixedInterval() {
            world = new World(2);
            machine = world.process();
            long id = newJob(machine);
            advanceTimes(machine, id, 3);
            assertEquals(BridgeState.ATTESTATION_PENDING, world.store.row(id).getState());

            StepVerifier.withVirtualTime(() -> machine.advance(id))
                .expectSubscription()
                .expectNoEvent(Duration.ofSeconds(29))
                .thenAwait(Duration.ofSeconds(1))
                .assertNext(result -> assertEquals(BridgeState.ATTESTATION_RECEIVED, result.toState()))
                .verifyComplete();

            verify(world.chain, times(3)).fetch(anyString());
        }

        @Test
        void attestationTimeoutFailsTheJobAndKeepsArtifacts() {
            world = new World(10_000);
            machine = world.process();
            long id = newJob(machine);
            advanceTimes(machine, id, 3);

            StepVerifier.withVirtualTime(() -> machine.advance(id))
                .expectSubscription()
                .thenAwait(Duration.ofMinutes(30))
                .assertNext(result -> {
                    assertFalse(result.success());
                    assertEquals(BridgeState.FAILED, result.toState());
                    assertThat(result.error()).contains("not received within PT30M");
                })
                .verifyComplete();

            BridgeJob row = world.store.row(id);
            assertEquals("ATTESTATION_PENDING", row.getFailedStep());
            assertNotNull(row.getLockRef());
            assertNotNull(row.getMessageHash());
            verify(world.chain, times(121)).fetch(anyString());
            verify(world.alertClient).send(argThat(a -> a.title().contains("failed at ATTESTATION_PENDING")));
        }

        @Test
        @DisplayName("deadline counts from the persisted request time, not from the restart")
        void expiredDeadlineFailsWithoutPolling() {
            world = new World(10_000);
            machine = world.process();
            long id = newJob(machine);
            advanceTimes(machine, id, 3);
            BridgeJob row = world.store.row(id);
            row.setAttestationRequestedAt(LocalDateTime.ofInstant(CLOCK.instant().minus(Duration.ofMinutes(31)), ZoneOffset.UTC));
            world.store.put(row);

            StepResult result = world.process().advance(id).block();

            assertEquals(BridgeState.FAILED, result.toState());
            verify(world.chain, never()).fetch(anyString());
        }
    }

    @Nested
    @DisplayName("Failure and retry")
    class Retry {

        @Test
        void stepFailureRecordsStepAndError() {
            world.rewardPool.failWith(new IllegalStateException("pool has no stakers"));
            long id = newJob(machine);

            BridgeJob failed = machine.resume(id).block();

            assertEquals(BridgeState.FAILED, failed.getState());
            assertEquals("DEST_MINTED", failed.getFailedStep());
            assertEquals("[DEST_MINTED] pool has no stakers", failed.getError());
            assertNotNull(failed.getMintRef());
            assertNull(failed.getDepositRef());
        }

        @Test
        void retryReopensAtArtifactStateWithoutRelocking() {
            world.rewardPool.failWith(new IllegalStateException("pool has no stakers"));
            long id = newJob(machine);
            machine.resume(id).block();
            world.rewardPool.failWith(null);

            BridgeJob reopened = machine.retry(id, false).block();
            assertEquals(BridgeState.DEST_MINTED, reopened.getState());
            assertEquals(1, reopened.getRetryCount());
            assertNull(reopened.getError());

            BridgeJob done = machine.resume(id).block();
            assertEquals(BridgeState.DEPOSITED, done.getState());
            verify(world.chain, times(1)).submitLock(anyLong(), anyLong());
        }

        @Test
        void retryIsBoundedUnlessForced() {
            world.rewardPool.failWith(new IllegalStateException("pool has no stakers"));
            long id = newJob(machine);
            machine.resume(id).block();
            for (int i = 0; i < 3; i++) {
                machine.retry(id, false).block();
                machine.resume(id).block();
            }
            assertEquals(3, world.store.row(id).getRetryCount());

            StepVerifier.create(machine.retry(id, false))
                .expectErrorSatisfies(e -> {
                    assertInstanceOf(InvalidJobStateException.class, e);
                    assertThat(e.getMessage()).contains("retry limit of 3");
                })
                .verify();
            verify(world.alertClient).send(argThat(a -> a.title().contains("needs manual intervention")));

            BridgeJob forced = machine.retry(id, true).block();
            assertEquals(4, forced.getRetryCount());
            assertEquals(BridgeState.DEST_MINTED, forced.getState());
        }

        @Test
        void retryOfAttestationTimeoutOpensFreshWindow() {
            long id = newJob(machine);
            advanceTimes(machine, id, 3);
            BridgeJob row = world.store.row(id);
            row.setAttestationRequestedAt(LocalDateTime.ofInstant(CLOCK.instant().minus(Duration.ofHours(1)), ZoneOffset.UTC));
            world.store.put(row);
            machine.advance(id).block();
            assertEquals(BridgeState.FAILED, world.store.row(id).getState());

            BridgeJob reopened = machine.retry(id, false).block();

            assertEquals(BridgeState.ATTESTATION_PENDING, reopened.getState());
            assertEquals(LocalDateTime.ofInstant(CLOCK.instant(), ZoneOffset.UTC), reopened.getAttestationRequestedAt());
            assertEquals(BridgeState.DEPOSITED, machine.resume(id).block().getState());
        }

        @Test
        void onlyFailedJobsCanBeRetried() {
            long id = newJob(machine);

            StepVerifier.create(machine.retry(id, true))
                .expectError(InvalidJobStateException.class)
                .verify();
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class Cancellation {

        @Test
        void readyJobWithoutLockIsCancelled() {
            long id = newJob(machine);

            BridgeJob cancelled = machine.cancel(id, "operator").block();

            assertEquals(BridgeState.CANCELLED, cancelled.getState());
            assertEquals("cancelled: operator", world.store.events(id).get(1).getDetail());
        }

        @Test
        void jobPastLockCannotBeCancelled() {
            long id = newJob(machine);
            machine.advance(id).block();

            StepVerifier.create(machine.cancel(id, null))
                .expectErrorSatisfies(e -> assertThat(e.getMessage()).contains("must be driven to DEPOSITED or FAILED"))
                .verify();
        }

        @Test
        void lockOnChainBlocksCancellationEvenWithoutRecordedRef() {
            long id = newJob(machine);
            world.chain.submitLock(id, AMOUNT).block();

            StepVerifier.create(machine.cancel(id, null))
                .expectErrorSatisfies(e -> assertThat(e.getMessage()).contains("already exists"))
                .verify();
            assertEquals(BridgeState.READY, world.store.row(id).getState());
        }

        @Test
        void failedJobThatNeverLockedCanBeCancelled() {
            doReturn(Mono.error(new IllegalStateException("rpc down"))).when(world.chain).submitLock(anyLong(), anyLong());
            long id = newJob(machine);
            assertEquals(BridgeState.FAILED, machine.advance(id).block().toState());

            BridgeJob cancelled = machine.cancel(id, "superseded").block();

            assertEquals(BridgeState.CANCELLED, cancelled.getState());
            BridgeEvent last = world.store.events(id).get(world.store.events(id).size() - 1);
            assertEquals("FAILED", last.getFromState());
            assertEquals("cancelled: superseded", last.getDetail());
        }

        @Test
        void failedJobWithLockCannotBeCancelled() {
            doReturn(Mono.error(new IllegalStateException("rpc down"))).when(world.chain).confirmation(anyString());
            long id = newJob(machine);
            advanceTimes(machine, id, 2);
            assertEquals(BridgeState.FAILED, world.store.row(id).getState());

            StepVerifier.create(machine.cancel(id, null))
                .expectErrorSatisfies(e -> assertThat(e.getMessage()).contains("cannot be cancelled in state FAILED"))
                .verify();
        }
    }

    @Nested
    @DisplayName("Unresolved jobs")
    class Unresolved {

        @Test
        void failedJobWithoutDepositStaysUnresolvedUntilCancelled() {
            doReturn(Mono.error(new IllegalStateException("rpc down"))).when(world.chain).submitLock(anyLong(), anyLong());
            long id = newJob(machine);
            machine.advance(id).block();

            assertThat(machine.pending().collectList().block()).isEmpty();
            assertThat(machine.unresolved().map(BridgeJob::getId).collectList().block()).containsExactly(id);

            machine.cancel(id, null).block();
            assertThat(machine.unresolved().collectList().block()).isEmpty();
        }

        @Test
        void depositedJobIsResolved() {
            long id = newJob(machine);
            machine.resume(id).block();

            assertThat(machine.unresolved().collectList().block()).isEmpty();
        }
    }

    @Nested
    @DisplayName("Job lease")
    class Lease {

        @Test
        void concurrentDriveOfSameJobFailsFast() {
            IdempotencyGuard guard = new IdempotencyGuard(CLOCK);
            BridgeStateMachine m = new BridgeStateMachine(world.store.jobRepository,
                new BridgeEventLog(world.store.eventRepository, CLOCK), world.chain, world.chain, world.chain,
                world.rewardPool, world.alertClient, guard, PROPS, CLOCK);
            long id = newJob(m);
            guard.tryAcquire("bridge:" + id, Duration.ofMinutes(5));

            StepVerifier.create(m.advance(id))
                .expectError(CycleInProgressException.class)
                .verify();

            StepVerifier.create(m.advanceAllPending())
                .assertNext(result -> {
                    assertFalse(result.success());
                    assertEquals(BridgeState.READY, result.toState());
                    assertThat(result.error()).contains("operation already in progress: bridge:" + id);
                })
                .verifyComplete();
        }

        @Test
        void advanceAllPendingTakesOldestFirstAndSkipsTerminal() {
            long first = newJob(machine);
            long second = newJob(machine);
            long done = newJob(machine);
            machine.resume(done).block();

            StepVerifier.create(machine.advanceAllPending())
                .assertNext(r -> assertEquals(first, r.jobId()))
                .assertNext(r -> assertEquals(second, r.jobId()))
                .verifyComplete();
        }
    }

    @Test
    void eventAppendFailureDoesNotFailTheStep() {
        long id = newJob(machine);
        when(world.store.eventRepository.save(any())).thenReturn(Mono.error(new IllegalStateException("db hiccup")));

        StepResult result = machine.advance(id).block();

        assertTrue(result.success());
        assertEquals(BridgeState.SOURCE_LOCKED, world.store.row(id).getState());
    }
}
