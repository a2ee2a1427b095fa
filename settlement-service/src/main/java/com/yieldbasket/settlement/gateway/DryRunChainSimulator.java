package com.yieldbasket.settlement.gateway;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Deterministic stand-in for both chains and the attestation service. References are
 * derived from the job id, so two runs of the same job produce identical artifacts.
 * Locks and mints are remembered so check-before-act lookups behave like the real chain.
 */
@Component
@ConditionalOnProperty(name = "settlement.dry-run", havingValue = "true", matchIfMissing = true)
public class DryRunChainSimulator implements SourceChainGateway, AttestationGateway, DestinationChainGateway {

    private static final Logger log = LoggerFactory.getLogger(DryRunChainSimulator.class);

    private final long accumulatedFeesRaw;
    private final double congestion;
    private final int attestationPendingPolls;

    private final Map<Long, String> locksByJob = new ConcurrentHashMap<>();
    private final Map<String, String> mintsByMessage = new ConcurrentHashMap<>();
    private final Map<String, AtomicInteger> attestationPolls = new ConcurrentHashMap<>();

    public DryRunChainSimulator(@Value("${settlement.simulated.accumulated-fees-raw:0}") long accumulatedFeesRaw,
                                @Value("${settlement.simulated.congestion:0.1}") double congestion,
                                @Value("${settlement.simulated.attestation-pending-polls:0}") int attestationPendingPolls) {
        this.accumulatedFeesRaw      = accumulatedFeesRaw;
        this.congestion              = congestion;
        this.attestationPendingPolls = attestationPendingPolls;
    }

    // ── source chain ────────────────────────────────────────────────────────

    @Override
    public Mono<String> findLock(long jobId) {
        return Mono.justOrEmpty(locksByJob.get(jobId));
    }

    @Override
    public Mono<String> submitLock(long jobId, long amountRaw) {
        return Mono.fromCallable(() -> {
            String lockRef = locksByJob.computeIfAbsent(jobId, id -> "lock-" + digest("lock:" + id).substring(0, 24));
            log.info("[DryRun] Source lock submitted. job={} amountRaw={} lockRef={}", jobId, amountRaw, lockRef);
            return lockRef;
        });
    }

    @Override
    public Mono<String> confirmation(String lockRef) {
        return Mono.fromCallable(() -> "0x" + digest("message:" + lockRef));
    }

    @Override
    public Mono<Long> accumulatedFeesRaw() {
        return Mono.just(accumulatedFeesRaw);
    }

    @Override
    public Mono<Double> congestion() {
        return Mono.just(congestion);
    }

    // ── attestation ─────────────────────────────────────────────────────────

    @Override
    public Mono<String> fetch(String messageHash) {
        return Mono.defer(() -> {
            int seen = attestationPolls.computeIfAbsent(messageHash, h -> new AtomicInteger()).getAndIncrement();
            if (seen < attestationPendingPolls) {
                return Mono.empty();
            }
            return Mono.just("0x" + digest("attestation:" + messageHash));
        });
    }

    // ── destination chain ───────────────────────────────────────────────────

    @Override
    public Mono<String> findMint(String messageHash) {
        return Mono.justOrEmpty(mintsByMessage.get(messageHash));
    }

    @Override
    public Mono<String> submitMint(String messageHash, String attestation) {
        return Mono.fromCallable(() -> {
            String mintRef = mintsByMessage.computeIfAbsent(messageHash,
                h -> "mint-" + digest("mint:" + h + ":" + attestation).substring(0, 24));
            log.info("[DryRun] Destination mint submitted. messageHash={} mintRef={}", messageHash, mintRef);
            return mintRef;
        });
    }

    private static String digest(String input) {
        try {
            MessageDigest sha = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(sha.digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 unavailable", e);
        }
    }
}
