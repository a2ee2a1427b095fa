package com.yieldbasket.settlement.gateway;

import reactor.core.publisher.Mono;

/**
 * Lock/burn side of the transfer. Every write is keyed by the job id so a retried
 * step can ask whether its earlier attempt already landed.
 */
public interface SourceChainGateway {

    /** Lock reference previously submitted for this job, or empty. */
    Mono<String> findLock(long jobId);

    Mono<String> submitLock(long jobId, long amountRaw);

    /** Message hash once the lock is final on chain; empty while still unconfirmed. */
    Mono<String> confirmation(String lockRef);

    /** Protocol fees waiting on the source chain, raw 6-decimal units. */
    Mono<Long> accumulatedFeesRaw();

    /** Source chain congestion in [0, 1]. */
    Mono<Double> congestion();
}
