package com.yieldbasket.settlement.gateway;

import reactor.core.publisher.Mono;

public interface DestinationChainGateway {

    /** Mint reference already recorded for this message, or empty. */
    Mono<String> findMint(String messageHash);

    Mono<String> submitMint(String messageHash, String attestation);
}
