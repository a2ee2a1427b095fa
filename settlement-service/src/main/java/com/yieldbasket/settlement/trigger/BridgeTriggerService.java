package com.yieldbasket.settlement.trigger;

import com.yieldbasket.common.exception.CycleInProgressException;
import com.yieldbasket.common.safety.GuardResult;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.common.safety.SafetyStatus;
import com.yieldbasket.common.safety.TransferLimiter;
import com.yieldbasket.settlement.client.SafetyStatusClient;
import com.yieldbasket.settlement.exception.TransferRejectedException;
import com.yieldbasket.settlement.gateway.SourceChainGateway;
import com.yieldbasket.settlement.model.BridgeJob;
import com.yieldbasket.settlement.model.BridgeState;
import com.yieldbasket.settlement.model.TriggerResult;
import com.yieldbasket.settlement.repository.BridgeJobRepository;
import com.yieldbasket.settlement.service.BridgeStateMachine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Starts bridge jobs. Separate from the state machine: this only decides whether a job
 * should exist. At most one job is unresolved at a time, a FAILED job with no deposit
 * included, so a later retry never bridges the same fees twice. Every new job passes the
 * safety flags and the transfer ceiling, measured against the persisted job rows of the
 * rolling window. The trigger lease serialises that check with the job insert.
 */
@Service
public class BridgeTriggerService {

    private static final Logger log = LoggerFactory.getLogger(BridgeTriggerService.class);

    static final String LEASE_KEY = "bridge-trigger";
    private static final Duration LEASE_TTL = Duration.ofMinutes(2);

    private final TriggerPolicy policy;
    private final TransferLimiter transferLimiter;
    private final SourceChainGateway sourceChain;
    private final SafetyStatusClient safetyStatusClient;
    private final BridgeJobRepository jobRepository;
    private final BridgeStateMachine stateMachine;
    private final IdempotencyGuard idempotencyGuard;
    private final Clock clock;

    public BridgeTriggerService(TriggerPolicy policy,
                                TransferLimiter transferLimiter,
                                SourceChainGateway sourceChain,
                                SafetyStatusClient safetyStatusClient,
                                BridgeJobRepository jobRepository,
                                BridgeStateMachine stateMachine,
                                IdempotencyGuard idempotencyGuard,
                                Clock clock) {
        this.policy             = policy;
        this.transferLimiter    = transferLimiter;
        this.sourceChain        = sourceChain;
        this.safetyStatusClient = safetyStatusClient;
        this.jobRepository      = jobRepository;
        this.stateMachine       = stateMachine;
        this.idempotencyGuard   = idempotencyGuard;
        this.clock              = clock;
    }

    /** Scheduled evaluation. Never errors for a policy reason; a skip carries its detail. */
    public Mono<TriggerResult> evaluate() {
        return withLease(() -> safetyStatusClient.current().flatMap(status -> {
            if (status.blocksMutations()) {
                return Mono.just(skip("safety halt: " + haltReason(status)));
            }
            return stateMachine.unresolved().next()
                .map(busy -> skip(busy.getState() == BridgeState.FAILED
                    ? "job " + busy.getId() + " failed at " + busy.getFailedStep() + " and awaits retry or cancel"
                    : "job " + busy.getId() + " still in flight at " + busy.getState()))
                .switchIfEmpty(Mono.defer(this::applyPolicy));
        }));
    }

    /** Operator-initiated job. Same safety and ceiling gates as the policy path, no threshold. */
    public Mono<BridgeJob> createManual(long amountRaw, String reason) {
        return withLease(() -> safetyStatusClient.current().flatMap(status -> {
            if (status.blocksMutations()) {
                return Mono.error(new TransferRejectedException("bridge blocked by safety halt: " + haltReason(status)));
            }
            return usedInWindow().flatMap(used -> {
                GuardResult allowed = transferLimiter.check(amountRaw, used);
                if (!allowed.allowed()) {
                    return Mono.error(new TransferRejectedException(allowed.reason()));
                }
                return stateMachine.create(amountRaw, reason != null && !reason.isBlank() ? reason : "MANUAL");
            });
        }));
    }

    private Mono<TriggerResult> applyPolicy() {
        Mono<Optional<Instant>> lastJobAt = jobRepository.findMostRecent()
            .map(job -> Optional.of(job.getCreatedAt().toInstant(ZoneOffset.UTC)))
            .defaultIfEmpty(Optional.empty());
        return Mono.zip(sourceChain.accumulatedFeesRaw(), sourceChain.congestion(), lastJobAt, usedInWindow())
            .flatMap(t -> {
                long used = t.getT4();
                TriggerPolicy.Input input = new TriggerPolicy.Input(
                    t.getT1(), t.getT2(), transferLimiter.headroom(used), t.getT3().orElse(null), clock.instant());
                TriggerPolicy.Outcome outcome = policy.evaluate(input);
                if (!outcome.fire()) {
                    return Mono.just(skip(outcome.detail()));
                }
                GuardResult allowed = transferLimiter.check(outcome.amountRaw(), used);
                if (!allowed.allowed()) {
                    return Mono.just(skip(allowed.reason()));
                }
                return stateMachine.create(outcome.amountRaw(), outcome.reason().name())
                    .map(job -> {
                        log.info("[Trigger] Bridge job started. job={} amountRaw={} {}",
                            job.getId(), job.getAmountRaw(), outcome.detail());
                        return TriggerResult.created(job, outcome.detail());
                    });
            });
    }

    /** Value already committed to non-cancelled jobs inside the rolling window. */
    private Mono<Long> usedInWindow() {
        LocalDateTime since = LocalDateTime.ofInstant(transferLimiter.windowStart(), ZoneOffset.UTC);
        return jobRepository.sumAmountCreatedSince(since).defaultIfEmpty(0L);
    }

    private TriggerResult skip(String detail) {
        log.info("[Trigger] No bridge job. reason={}", detail);
        return TriggerResult.skipped(detail);
    }

    private static String haltReason(SafetyStatus status) {
        return status.killSwitchEngaged() ? status.killSwitchReason() : status.lossHaltReason();
    }

    private <T> Mono<T> withLease(Supplier<Mono<T>> work) {
        return Mono.defer(() -> {
            Optional<IdempotencyGuard.Lease> lease = idempotencyGuard.tryAcquire(LEASE_KEY, LEASE_TTL);
            if (lease.isEmpty()) {
                return Mono.error(new CycleInProgressException(LEASE_KEY));
            }
            return work.get().doFinally(signal -> idempotencyGuard.release(lease.get()));
        });
    }
}
