package com.yieldbasket.common.safety;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Short-TTL exclusive lock keyed by operation identity ("cycle", "bridge-job:42",
 * "submit:<decisionId>"). An expired lease is reclaimable by the next caller.
 * Release requires the lease token so a late release cannot free a successor's lock.
 */
public class IdempotencyGuard {

    public static final String NAME = "idempotency";

    public record Lease(String key, String token, Instant expiresAt) {}

    private final Clock clock;
    private final ConcurrentMap<String, Lease> leases = new ConcurrentHashMap<>();

    public IdempotencyGuard(Clock clock) {
        this.clock = clock;
    }

    public Optional<Lease> tryAcquire(String key, Duration ttl) {
        for (;;) {
            Instant now = clock.instant();
            Lease fresh = new Lease(key, UUID.randomUUID().toString(), now.plus(ttl));
            Lease existing = leases.putIfAbsent(key, fresh);
            if (existing == null) {
                return Optional.of(fresh);
            }
            if (!now.isBefore(existing.expiresAt())) {
                if (leases.replace(key, existing, fresh)) {
                    return Optional.of(fresh);
                }
                continue; // lost race against another reclaimer
            }
            return Optional.empty();
        }
    }

    public boolean release(Lease lease) {
        return lease != null && leases.remove(lease.key(), lease);
    }

    public boolean isHeld(String key) {
        Lease lease = leases.get(key);
        return lease != null && clock.instant().isBefore(lease.expiresAt());
    }

    public GuardResult check(String key) {
        return isHeld(key) ? GuardResult.block(NAME, "operation already in progress: " + key) : GuardResult.allow(NAME);
    }
}
