package com.yieldbasket.settlement.gateway;

import reactor.core.publisher.Mono;

public interface AttestationGateway {

    /** Signed attestation for the message, or empty while it is still pending. */
    Mono<String> fetch(String messageHash);
}
