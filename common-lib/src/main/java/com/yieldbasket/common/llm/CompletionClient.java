package com.yieldbasket.common.llm;

import reactor.core.publisher.Mono;

import java.time.Duration;

/**
 * Text completion service used by producer, advocate and judge roles.
 * Callers validate the returned text with {@link StructuredOutput}.
 */
public interface CompletionClient {

    /** False when no credentials are configured; callers then use their rule-based baseline. */
    boolean isEnabled();

    /**
     * @param prompt  full user prompt
     * @param timeout hard deadline; the returned Mono errors with a TimeoutException past it
     * @return the model's raw text reply
     */
    Mono<String> complete(String prompt, Duration timeout);
}
