package com.yieldbasket.orchestrator.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Debate bounds. {@code maxRounds} is clamped to the hard ceiling of three. */
@Component
public class DebateProperties {

    public static final int HARD_ROUND_CAP = 3;

    private final int maxRounds;
    private final double convergenceGap;
    private final Duration roundTimeout;
    private final int maxRoundRetries;

    public DebateProperties(@Value("${orchestrator.debate.max-rounds:3}") int maxRounds,
                            @Value("${orchestrator.debate.convergence-gap:0.15}") double convergenceGap,
                            @Value("${orchestrator.debate.round-timeout-ms:30000}") long roundTimeoutMs,
                            @Value("${orchestrator.debate.max-round-retries:2}") int maxRoundRetries) {
        this.maxRounds       = Math.max(1, Math.min(HARD_ROUND_CAP, maxRounds));
        this.convergenceGap  = convergenceGap;
        this.roundTimeout    = Duration.ofMillis(roundTimeoutMs);
        this.maxRoundRetries = Math.max(0, maxRoundRetries);
    }

    public int maxRounds()          { return maxRounds; }
    public double convergenceGap()  { return convergenceGap; }
    public Duration roundTimeout()  { return roundTimeout; }
    public int maxRoundRetries()    { return maxRoundRetries; }
}
