package com.yieldbasket.settlement.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Poll bounds and retry limits for the settlement state machine. */
@Component
public class SettlementProperties {

    private final Duration attestationPollInterval;
    private final Duration attestationTimeout;
    private final Duration confirmationPollInterval;
    private final Duration confirmationTimeout;
    private final int maxRetries;
    private final Duration jobLeaseTtl;

    public SettlementProperties(@Value("${settlement.attestation.poll-interval:PT15S}") Duration attestationPollInterval,
                                @Value("${settlement.attestation.timeout:PT30M}") Duration attestationTimeout,
                                @Value("${settlement.confirmation-poll-interval:PT5S}") Duration confirmationPollInterval,
                                @Value("${settlement.confirmation-timeout:PT2M}") Duration confirmationTimeout,
                                @Value("${settlement.max-retries:3}") int maxRetries,
                                @Value("${settlement.job-lease-ttl:PT40M}") Duration jobLeaseTtl) {
        this.attestationPollInterval  = attestationPollInterval;
        this.attestationTimeout       = attestationTimeout;
        this.confirmationPollInterval = confirmationPollInterval;
        this.confirmationTimeout      = confirmationTimeout;
        this.maxRetries               = Math.max(0, maxRetries);
        this.jobLeaseTtl              = jobLeaseTtl;
    }

    public Duration attestationPollInterval()  { return attestationPollInterval; }
    public Duration attestationTimeout()       { return attestationTimeout; }
    public Duration confirmationPollInterval() { return confirmationPollInterval; }
    public Duration confirmationTimeout()      { return confirmationTimeout; }
    public int maxRetries()                    { return maxRetries; }
    public Duration jobLeaseTtl()              { return jobLeaseTtl; }
}
