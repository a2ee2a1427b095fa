package com.yieldbasket.orchestrator.safety;

import com.yieldbasket.common.model.Alert;
import com.yieldbasket.common.risk.RiskInput;
import com.yieldbasket.common.safety.GuardResult;
import com.yieldbasket.common.safety.IdempotencyGuard;
import com.yieldbasket.common.safety.KillSwitch;
import com.yieldbasket.common.safety.LossHaltGuard;
import com.yieldbasket.common.safety.PortfolioGuard;
import com.yieldbasket.common.safety.SafetyStatus;
import com.yieldbasket.orchestrator.client.AlertClient;
import com.yieldbasket.orchestrator.model.SafetyFlagEvent;
import com.yieldbasket.orchestrator.repository.SafetyFlagEventRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;
import reactor.util.retry.Retry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

/**
 * Composes the guards the orchestrator consults before a cycle and again before submission.
 * Each guard stays independent; this class only routes calls, raises alerts and keeps the
 * two operator flags (kill switch, loss halt) in the safety flag log so a restart comes
 * back in the same state.
 */
@Component
public class SafetySystem {

    private static final Logger log = LoggerFactory.getLogger(SafetySystem.class);
    private static final String SOURCE = "agent-orchestrator";
    private static final int WRITE_RETRIES = 2;

    private final KillSwitch killSwitch;
    private final LossHaltGuard lossHalt;
    private final PortfolioGuard portfolioGuard;
    private final IdempotencyGuard idempotencyGuard;
    private final AlertClient alertClient;
    private final SafetyFlagEventRepository flagRepository;
    private final Clock clock;
    private final Duration restoreTimeout;

    private volatile boolean haltRecorded;

    public SafetySystem(KillSwitch killSwitch, LossHaltGuard lossHalt, PortfolioGuard portfolioGuard,
                        IdempotencyGuard idempotencyGuard, AlertClient alertClient,
                        SafetyFlagEventRepository flagRepository, Clock clock,
                        @Value("${safety.restore-timeout:PT30S}") Duration restoreTimeout) {
        this.killSwitch       = killSwitch;
        this.lossHalt         = lossHalt;
        this.portfolioGuard   = portfolioGuard;
        this.idempotencyGuard = idempotencyGuard;
        this.alertClient      = alertClient;
        this.flagRepository   = flagRepository;
        this.clock            = clock;
        this.restoreTimeout   = restoreTimeout;
    }

    /** Startup fails if the flag log cannot be read: an unknown halt state is not a clear one. */
    @PostConstruct
    public void restoreOnStartup() {
        SafetyStatus restored = restore().block(restoreTimeout);
        log.info("[Safety] Flags restored. killSwitch={} lossHalt={}",
            restored.killSwitchEngaged(), restored.lossHalted());
    }

    /** Re-applies the newest recorded state of each flag. */
    public Mono<SafetyStatus> restore() {
        return Mono.zip(latest(KillSwitch.NAME), latest(LossHaltGuard.NAME))
            .map(flags -> {
                flags.getT1().filter(SafetyFlagEvent::isEngaged).ifPresent(event -> {
                    killSwitch.engage(event.getReason());
                    log.warn("[Safety] Kill switch still engaged from before restart. reason={}", event.getReason());
                });
                flags.getT2().filter(SafetyFlagEvent::isEngaged).ifPresent(event -> {
                    lossHalt.restore(event.getReason(), toInstant(event.getRaisedAt()));
                    haltRecorded = true;
                    log.warn("[Safety] Loss halt still engaged from before restart. reason={} haltedAt={}",
                        event.getReason(), event.getRaisedAt());
                });
                return status();
            });
    }

    /** First blocking reason among kill switch and loss halt, if any. */
    public Optional<String> mutationBlock() {
        GuardResult kill = killSwitch.check();
        if (!kill.allowed()) return Optional.of(kill.reason());
        GuardResult halt = lossHalt.check();
        if (!halt.allowed()) return Optional.of(halt.reason());
        return Optional.empty();
    }

    /**
     * Feeds a NAV reading to the loss-halt guard, alerts when it trips and records the halt.
     * A halt that could not be recorded is written again on the next reading.
     */
    public Mono<Void> observeNav(double navUsd, String traceId) {
        return Mono.defer(() -> {
            if (lossHalt.observe(navUsd)) {
                log.error("[Safety] Loss halt engaged. reason={} traceId={}", lossHalt.haltReason(), traceId);
                alertClient.send(Alert.critical(SOURCE, "Loss halt engaged", lossHalt.haltReason(), traceId));
            }
            if (!lossHalt.isHalted() || haltRecorded) {
                return Mono.empty();
            }
            return record(LossHaltGuard.NAME, true, lossHalt.haltReason(), lossHalt.haltedAt())
                .doOnNext(saved -> haltRecorded = true)
                .then();
        });
    }

    public GuardResult checkExecution(RiskInput atExecution) {
        return portfolioGuard.check(atExecution);
    }

    public Optional<IdempotencyGuard.Lease> tryAcquire(String key, Duration ttl) {
        return idempotencyGuard.tryAcquire(key, ttl);
    }

    public void release(IdempotencyGuard.Lease lease) {
        if (!idempotencyGuard.release(lease)) {
            log.warn("[Safety] Lease already expired or reclaimed. key={}", lease.key());
        }
    }

    // ── operator surface ────────────────────────────────────────────────────

    public SafetyStatus status() {
        return new SafetyStatus(killSwitch.isEngaged(), killSwitch.reason(),
                                lossHalt.isHalted(), lossHalt.haltReason(), lossHalt.haltedAt());
    }

    /** Takes effect in memory at once; the returned Mono fails if the flag could not be recorded. */
    public Mono<SafetyStatus> engageKillSwitch(String reason) {
        return Mono.defer(() -> {
            killSwitch.engage(reason);
            log.warn("[Safety] Kill switch engaged. reason={}", reason);
            alertClient.send(Alert.critical(SOURCE, "Kill switch engaged", reason, null));
            return record(KillSwitch.NAME, true, killSwitch.reason(), null).map(saved -> status());
        });
    }

    /** Recorded first, released after; a failed write leaves the switch engaged. */
    public Mono<SafetyStatus> releaseKillSwitch() {
        return record(KillSwitch.NAME, false, null, null)
            .map(saved -> {
                killSwitch.release();
                log.info("[Safety] Kill switch released.");
                alertClient.send(Alert.warning(SOURCE, "Kill switch released", "cycles resume on next trigger", null));
                return status();
            });
    }

    /** Recorded first, cleared after; a failed write leaves the halt in place. */
    public Mono<SafetyStatus> clearLossHalt() {
        return Mono.defer(() -> {
            String previous = lossHalt.haltReason();
            return record(LossHaltGuard.NAME, false, null, null)
                .map(saved -> {
                    lossHalt.clear();
                    haltRecorded = false;
                    log.info("[Safety] Loss halt cleared. previousReason={}", previous);
                    alertClient.send(Alert.warning(SOURCE, "Loss halt cleared", String.valueOf(previous), null));
                    return status();
                });
        });
    }

    // ── flag log ────────────────────────────────────────────────────────────

    private Mono<SafetyFlagEvent> record(String flag, boolean engaged, String reason, Instant raisedAt) {
        return Mono.defer(() -> {
            SafetyFlagEvent event = new SafetyFlagEvent();
            event.setFlag(flag);
            event.setEngaged(engaged);
            event.setReason(reason);
            event.setRaisedAt(raisedAt != null ? LocalDateTime.ofInstant(raisedAt, ZoneOffset.UTC) : null);
            event.setRecordedAt(LocalDateTime.ofInstant(clock.instant(), ZoneOffset.UTC));
            return flagRepository.save(event);
        })
        .retryWhen(Retry.backoff(WRITE_RETRIES, Duration.ofMillis(100)))
        .doOnError(e -> log.error("[Safety] Flag not recorded. flag={} engaged={} reason={}",
            flag, engaged, e.getMessage()));
    }

    private Mono<Optional<SafetyFlagEvent>> latest(String flag) {
        return flagRepository.findFirstByFlagOrderByIdDesc(flag)
            .map(Optional::of)
            .defaultIfEmpty(Optional.empty());
    }

    private static Instant toInstant(LocalDateTime at) {
        return at != null ? at.toInstant(ZoneOffset.UTC) : null;
    }
}
