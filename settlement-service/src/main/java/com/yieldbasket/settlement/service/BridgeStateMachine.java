package com.yieldbasket.settlement.service;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.common.exception.SettlementStepException;
import com.yieldbasket.common.model.Alert;
import com.yieldbasket.common.model.RewardDepositRequest;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.settlement.client.AlertClient;
import com.yieldbasket.settlement.config.SettlementProperties;
import com.yieldbasket.settlement.exception.BridgeJobNotFoundException;
import com.yieldbasket.settlement.exception.InvalidJobStateException;
import com.yieldbasket.settlement.gateway.AttestationGateway;
import com.yieldbasket.settlement.gateway.DestinationChainGateway;
import com.yieldbasket.settlement.gateway.RewardPoolGateway;
import com.yieldbasket.settlement.gateway.SourceChainGateway;
import com.yieldbasket.settlement.model.BridgeJob;
import com.yieldbasket.settlement.model.BridgeState;
import com.yieldbasket.settlement.model.StepResult;
import com.yieldbasket.settlement.repository.BridgeJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.EnumSet;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Persisted settlement state machine.
 *
 * <h3>Step contract</h3>
 * <ol>
 *   <li>The step to run is derived from the artifacts on the job, never from a counter:
 *       a job with a mint reference only ever retries the deposit.</li>
 *   <li>Each step writes its artifact and the next state in one row update before the
 *       following step may start.</li>
 *   <li>Chain writes look up an earlier attempt first ({@code findLock}, {@code findMint}),
 *       so a crash between submission and persistence never submits twice.</li>
 *   <li>A failing step moves the job to FAILED with the step name and error; artifacts stay.
 *       FAILED jobs are only reopened by an explicit {@link #retry}.</li>
 * </ol>
 *
 * Every mutating entry point holds the job lease {@code bridge:<id>}.
 */
@Service
public class BridgeStateMachine {

    private static final Logger log = LoggerFactory.getLogger(BridgeStateMachine.class);

    static final String ALERT_SOURCE = "settlement-service";
    static final int MAX_LIMIT = 200;

    private static final EnumSet<BridgeState> TERMINAL =
        EnumSet.of(BridgeState.DEPOSITED, BridgeState.FAILED, BridgeState.CANCELLED);
    private static final EnumSet<BridgeState> SETTLED =
        EnumSet.of(BridgeState.DEPOSITED, BridgeState.CANCELLED);

    private final BridgeJobRepository jobRepository;
    private final BridgeEventLog eventLog;
    private final SourceChainGateway sourceChain;
    private final AttestationGateway attestations;
    private final DestinationChainGateway destinationChain;
    private final RewardPoolGateway rewardPool;
    private final AlertClient alertClient;
    private final IdempotencyGuard idempotencyGuard;
    private final SettlementProperties properties;
    private final Clock clock;

    public BridgeStateMachine(BridgeJobRepository jobRepository,
                              BridgeEventLog eventLog,
                              SourceChainGateway sourceChain,
                              AttestationGateway attestations,
                              DestinationChainGateway destinationChain,
                              RewardPoolGateway rewardPool,
                              AlertClient alertClient,
                              IdempotencyGuard idempotencyGuard,
                              SettlementProperties properties,
                              Clock clock) {
        this.jobRepository    = jobRepository;
        this.eventLog         = eventLog;
        this.sourceChain      = sourceChain;
        this.attestations     = attestations;
        this.destinationChain = destinationChain;
        this.rewardPool       = rewardPool;
        this.alertClient      = alertClient;
        this.idempotencyGuard = idempotencyGuard;
        this.properties       = properties;
        this.clock            = clock;
    }

    /** Furthest state the job's artifacts prove it has durably completed. */
    public static BridgeState resumeState(BridgeJob job) {
        if (job.getDepositRef() != null)             return BridgeState.DEPOSITED;
        if (job.getMintRef() != null)                return BridgeState.DEST_MINTED;
        if (job.getAttestation() != null)            return BridgeState.ATTESTATION_RECEIVED;
        if (job.getAttestationRequestedAt() != null) return BridgeState.ATTESTATION_PENDING;
        if (job.getMessageHash() != null)            return BridgeState.SOURCE_CONFIRMED;
        if (job.getLockRef() != null)                return BridgeState.SOURCE_LOCKED;
        return BridgeState.READY;
    }

    // ── creation and queries ────────────────────────────────────────────────

    public Mono<BridgeJob> create(long amountRaw, String triggerReason) {
        if (amountRaw <= 0) {
            return Mono.error(new IllegalArgumentException("bridge amount must be positive, got " + amountRaw));
        }
        return Mono.defer(() -> {
            BridgeJob job = new BridgeJob();
            job.setAmountRaw(amountRaw);
            job.setState(BridgeState.READY);
            job.setTriggerReason(triggerReason);
            job.setRetryCount(0);
            job.setCreatedAt(now());
            job.setUpdatedAt(job.getCreatedAt());
            return jobRepository.save(job);
        })
        .flatMap(saved -> recordEvent(saved, null, BridgeState.READY,
            "created amountRaw=" + amountRaw + " reason=" + triggerReason))
        .doOnNext(saved -> log.info("[Bridge] Job created. job={} amountRaw={} reason={}",
            saved.getId(), amountRaw, triggerReason));
    }

    public Mono<BridgeJob> findJob(long jobId) {
        return jobRepository.findById(jobId)
            .switchIfEmpty(Mono.error(new BridgeJobNotFoundException(jobId)));
    }

    /** Newest first. */
    public Flux<BridgeJob> latest(int limit) {
        return jobRepository.findLatest(Math.max(1, Math.min(MAX_LIMIT, limit)));
    }

    /** Non-terminal jobs, oldest first. */
    public Flux<BridgeJob> pending() {
        return jobRepository.findByStateNotInOrderByCreatedAtAsc(TERMINAL);
    }

    /**
     * Jobs still holding their value: pending ones, plus FAILED ones with no deposit that
     * wait for an operator retry or cancel. Oldest first.
     */
    public Flux<BridgeJob> unresolved() {
        return jobRepository.findByStateNotInOrderByCreatedAtAsc(SETTLED)
            .filter(job -> job.getState() != BridgeState.FAILED || job.getDepositRef() == null);
    }

    // ── driving ─────────────────────────────────────────────────────────────

    /** Runs exactly one step. A terminal job is reported as-is. */
    public Mono<StepResult> advance(long jobId) {
        return withLease(jobId, () -> findJob(jobId).flatMap(job -> {
            BridgeState from = job.getState();
            if (from.isTerminal()) {
                return Mono.just(StepResult.of(from, job));
            }
            return step(job).map(after -> StepResult.of(from, after));
        }));
    }

    /** Drives the job from whatever its artifacts prove to a terminal state. */
    public Mono<BridgeJob> resume(long jobId) {
        return withLease(jobId, () -> findJob(jobId)
            .doOnNext(job -> log.info("[Bridge] Resuming. job={} state={} resumeFrom={}",
                job.getId(), job.getState(), job.getState().isTerminal() ? job.getState() : resumeState(job)))
            .flatMap(this::driveToTerminal));
    }

    /** One step for every pending job, oldest first. A job that cannot be advanced yields a failed result. */
    public Flux<StepResult> advanceAllPending() {
        return pending()
            .concatMap(job -> advance(job.getId())
                .onErrorResume(e -> {
                    log.warn("[Bridge] Pending job not advanced. job={} reason={}", job.getId(), e.getMessage());
                    return Mono.just(new StepResult(job.getId(), job.getState(), job.getState(), false, e.getMessage()));
                }));
    }

    private Mono<BridgeJob> driveToTerminal(BridgeJob job) {
        if (job.getState().isTerminal()) {
            return Mono.just(job);
        }
        return step(job).flatMap(this::driveToTerminal);
    }

    Mono<BridgeJob> step(BridgeJob job) {
        BridgeState from = resumeState(job);
        return Mono.defer(() -> {
                switch (from) {
                    case READY:                return lock(job);
                    case SOURCE_LOCKED:        return confirm(job);
                    case SOURCE_CONFIRMED:     return requestAttestation(job);
                    case ATTESTATION_PENDING:  return awaitAttestation(job);
                    case ATTESTATION_RECEIVED: return mint(job);
                    case DEST_MINTED:          return deposit(job);
                    default:
                        return Mono.<String>error(new IllegalStateException("no step leaves " + from));
                }
            })
            .flatMap(detail -> transition(job, from, from.next(), detail))
            .onErrorResume(err -> fail(job, from, err));
    }

    // ── steps ───────────────────────────────────────────────────────────────

    private Mono<String> lock(BridgeJob job) {
        return sourceChain.findLock(job.getId())
            .doOnNext(existing -> log.warn("[Bridge] Lock already on chain, reusing it. job={} lockRef={}",
                job.getId(), existing))
            .switchIfEmpty(Mono.defer(() -> sourceChain.submitLock(job.getId(), job.getAmountRaw())))
            .switchIfEmpty(Mono.error(new SettlementStepException(BridgeState.READY.name(),
                "lock submission returned no reference")))
            .map(lockRef -> {
                job.setLockRef(lockRef);
                return "lockRef=" + lockRef;
            });
    }

    private Mono<String> confirm(BridgeJob job) {
        Duration interval = properties.confirmationPollInterval();
        long polls = properties.confirmationTimeout().toMillis() / Math.max(1, interval.toMillis());
        return poll(() -> sourceChain.confirmation(job.getLockRef()), interval, polls)
            .switchIfEmpty(Mono.error(new SettlementStepException(BridgeState.SOURCE_LOCKED.name(),
                "lock " + job.getLockRef() + " not confirmed within " + properties.confirmationTimeout())))
            .map(messageHash -> {
                job.setMessageHash(messageHash);
                return "messageHash=" + messageHash;
            });
    }

    private Mono<String> requestAttestation(BridgeJob job) {
        job.setAttestationRequestedAt(now());
        return Mono.just("attestation requested for messageHash=" + job.getMessageHash());
    }

    /** Bounded poll measured from the persisted request time, so a restart does not extend the deadline. */
    private Mono<String> awaitAttestation(BridgeJob job) {
        Duration interval = properties.attestationPollInterval();
        Instant deadline = job.getAttestationRequestedAt().toInstant(ZoneOffset.UTC)
            .plus(properties.attestationTimeout());
        Instant now = clock.instant();
        SettlementStepException timeout = new SettlementStepException(BridgeState.ATTESTATION_PENDING.name(),
            "attestation for messageHash=" + job.getMessageHash() + " not received within "
                + properties.attestationTimeout());
        if (!now.isBefore(deadline)) {
            return Mono.error(timeout);
        }
        long polls = Duration.between(now, deadline).toMillis() / Math.max(1, interval.toMillis());
        return poll(() -> attestations.fetch(job.getMessageHash()), interval, polls)
            .switchIfEmpty(Mono.error(timeout))
            .map(attestation -> {
                job.setAttestation(attestation);
                return "attestation received";
            });
    }

    private Mono<String> mint(BridgeJob job) {
        return destinationChain.findMint(job.getMessageHash())
            .doOnNext(existing -> log.warn("[Bridge] Mint already on chain, reusing it. job={} mintRef={}",
                job.getId(), existing))
            .switchIfEmpty(Mono.defer(() -> destinationChain.submitMint(job.getMessageHash(), job.getAttestation())))
            .switchIfEmpty(Mono.error(new SettlementStepException(BridgeState.ATTESTATION_RECEIVED.name(),
                "mint submission returned no reference")))
            .map(mintRef -> {
                job.setMintRef(mintRef);
                return "mintRef=" + mintRef;
            });
    }

    private Mono<String> deposit(BridgeJob job) {
        RewardDepositRequest request = new RewardDepositRequest(depositReference(job.getId()), job.getAmountRaw());
        return rewardPool.deposit(request)
            .switchIfEmpty(Mono.error(new SettlementStepException(BridgeState.DEST_MINTED.name(),
                "reward pool returned no receipt")))
            .map(receipt -> {
                job.setDepositRef(receipt.reference());
                job.setNetDepositedRaw(receipt.creditedRaw());
                return "depositRef=" + receipt.reference() + " creditedRaw=" + receipt.creditedRaw()
                    + (receipt.duplicate() ? " (already deposited)" : "");
            });
    }

    static String depositReference(long jobId) {
        return "bridge-" + jobId;
    }

    /** First check immediately, then up to {@code remainingPolls} more, {@code interval} apart. */
    private static <T> Mono<T> poll(Supplier<Mono<T>> check, Duration interval, long remainingPolls) {
        return Mono.defer(check)
            .switchIfEmpty(Mono.defer(() -> remainingPolls <= 0
                ? Mono.<T>empty()
                : Mono.delay(interval).then(poll(check, interval, remainingPolls - 1))));
    }

    // ── persistence of outcomes ─────────────────────────────────────────────

    private Mono<BridgeJob> transition(BridgeJob job, BridgeState from, BridgeState to, String detail) {
        job.setState(to);
        job.setUpdatedAt(now());
        return jobRepository.save(job)
            .doOnNext(saved -> log.info("[Bridge] Transition. job={} from={} to={} {}",
                saved.getId(), from, to, detail))
            .flatMap(saved -> recordEvent(saved, from, to, detail));
    }

    private Mono<BridgeJob> fail(BridgeJob job, BridgeState from, Throwable err) {
        SettlementStepException failure = err instanceof SettlementStepException
            ? (SettlementStepException) err
            : new SettlementStepException(from.name(), describe(err), err);
        job.setState(BridgeState.FAILED);
        job.setFailedStep(failure.getStep());
        job.setError(failure.getMessage());
        job.setUpdatedAt(now());
        log.error("[Bridge] Step failed. job={} step={} retryCount={} error={}",
            job.getId(), failure.getStep(), job.getRetryCount(), failure.getMessage(), err);
        return jobRepository.save(job)
            .flatMap(saved -> recordEvent(saved, from, BridgeState.FAILED, failure.getMessage()))
            .doOnNext(saved -> alertClient.send(Alert.critical(ALERT_SOURCE,
                "Bridge job " + saved.getId() + " failed at " + failure.getStep(),
                failure.getMessage() + " (retry " + saved.getRetryCount() + "/" + properties.maxRetries() + ")",
                null)));
    }

    private Mono<BridgeJob> recordEvent(BridgeJob job, BridgeState from, BridgeState to, String detail) {
        return eventLog.append(job.getId(), from, to, detail)
            .thenReturn(job)
            .onErrorResume(e -> {
                log.warn("[Bridge] Event append failed (non-critical). job={} to={}", job.getId(), to, e);
                return Mono.just(job);
            });
    }

    // ── operator actions ────────────────────────────────────────────────────

    /**
     * Reopens a FAILED job at the state its artifacts prove. Refused once the retry bound is
     * reached unless {@code force} is set. A reopened attestation wait gets a fresh window.
     */
    public Mono<BridgeJob> retry(long jobId, boolean force) {
        return withLease(jobId, () -> findJob(jobId).flatMap(job -> {
            if (job.getState() != BridgeState.FAILED) {
                return Mono.error(new InvalidJobStateException(
                    "job " + jobId + " is " + job.getState() + ", only FAILED jobs can be retried"));
            }
            if (job.getRetryCount() >= properties.maxRetries() && !force) {
                log.error("[Bridge] Retry limit reached. job={} retryCount={} lastError={}",
                    jobId, job.getRetryCount(), job.getError());
                alertClient.send(Alert.critical(ALERT_SOURCE,
                    "Bridge job " + jobId + " needs manual intervention",
                    "retry limit " + properties.maxRetries() + " reached; last error: " + job.getError(), null));
                return Mono.error(new InvalidJobStateException("job " + jobId + " reached the retry limit of "
                    + properties.maxRetries() + "; a forced retry is required"));
            }
            BridgeState reopened = resumeState(job);
            String lastError = job.getError();
            job.setRetryCount(job.getRetryCount() + 1);
            job.setState(reopened);
            job.setError(null);
            job.setFailedStep(null);
            if (reopened == BridgeState.ATTESTATION_PENDING) {
                job.setAttestationRequestedAt(now());
            }
            job.setUpdatedAt(now());
            String detail = "retry " + job.getRetryCount() + "/" + properties.maxRetries()
                + (force ? " forced" : "") + " after: " + lastError;
            return jobRepository.save(job)
                .doOnNext(saved -> log.info("[Bridge] Job reopened. job={} state={} retryCount={} force={}",
                    saved.getId(), reopened, saved.getRetryCount(), force))
                .flatMap(saved -> recordEvent(saved, BridgeState.FAILED, reopened, detail));
        }));
    }

    /**
     * Only a READY job, or a FAILED one that never locked, can be cancelled, and only while
     * no source lock exists on chain either.
     */
    public Mono<BridgeJob> cancel(long jobId, String reason) {
        return withLease(jobId, () -> findJob(jobId).flatMap(job -> {
            BridgeState from = job.getState();
            boolean cancellable = (from == BridgeState.READY || from == BridgeState.FAILED) && job.getLockRef() == null;
            if (!cancellable) {
                return Mono.error(new InvalidJobStateException("job " + jobId + " cannot be cancelled in state "
                    + from + ": it must be driven to DEPOSITED or FAILED"));
            }
            return sourceChain.findLock(jobId)
                .flatMap(lockRef -> Mono.<BridgeJob>error(new InvalidJobStateException(
                    "job " + jobId + " cannot be cancelled: source lock " + lockRef + " already exists")))
                .switchIfEmpty(Mono.defer(() -> {
                    job.setState(BridgeState.CANCELLED);
                    job.setUpdatedAt(now());
                    return jobRepository.save(job)
                        .doOnNext(saved -> log.info("[Bridge] Job cancelled. job={} from={} reason={}",
                            saved.getId(), from, reason))
                        .flatMap(saved -> recordEvent(saved, from, BridgeState.CANCELLED,
                            "cancelled: " + (reason != null ? reason : "operator request")));
                }));
        }));
    }

    // ── helpers ─────────────────────────────────────────────────────────────

    private <T> Mono<T> withLease(long jobId, Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            String key = "bridge:" + jobId;
            Optional<IdempotencyGuard.Lease> lease = idempotencyGuard.tryAcquire(key, properties.jobLeaseTtl());
            if (lease.isEmpty()) {
                return Mono.error(new CycleInProgressException(key));
            }
            return work.get().doFinally(signal -> idempotencyGuard.release(lease.get()));
        });
    }

    private LocalDateTime now() {
        return LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC);
    }

    private static String describe(Throwable err) {
        return err.getMessage() != null ? err.getMessage() : err.getClass().getSimpleName();
    }
}
