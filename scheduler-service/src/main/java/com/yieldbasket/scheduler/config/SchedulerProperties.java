package com.yieldbasket.scheduler.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;

/** Loop intervals and per-call bounds for the periodic triggers. */
@Component
public class SchedulerProperties {

    private final boolean  enabled;
    private final Duration initialDelay;
    private final Duration cycleInterval;
    private final Duration reflectionInterval;
    private final Duration settlementInterval;
    private final Duration settlementActiveInterval;
    private final Duration failureBackoff;
    private final Duration cycleTimeout;
    private final Duration reflectionTimeout;
    private final Duration settlementTimeout;

    public SchedulerProperties(@Value("${scheduler.enabled:true}") boolean enabled,
                               @Value("${scheduler.initial-delay:PT30S}") Duration initialDelay,
                               @Value("${scheduler.cycle-interval:PT1H}") Duration cycleInterval,
                               @Value("${scheduler.reflection-interval:PT6H}") Duration reflectionInterval,
                               @Value("${scheduler.settlement-interval:PT1H}") Duration settlementInterval,
                               @Value("${scheduler.settlement-active-interval:PT2M}") Duration settlementActiveInterval,
                               @Value("${scheduler.failure-backoff:PT5M}") Duration failureBackoff,
                               @Value("${scheduler.cycle-timeout:PT5M}") Duration cycleTimeout,
                               @Value("${scheduler.reflection-timeout:PT2M}") Duration reflectionTimeout,
                               @Value("${scheduler.settlement-timeout:PT35M}") Duration settlementTimeout) {
        this.enabled                  = enabled;
        this.initialDelay             = initialDelay;
        this.cycleInterval            = cycleInterval;
        this.reflectionInterval       = reflectionInterval;
        this.settlementInterval       = settlementInterval;
        this.settlementActiveInterval = settlementActiveInterval;
        this.failureBackoff           = failureBackoff;
        this.cycleTimeout             = cycleTimeout;
        this.reflectionTimeout        = reflectionTimeout;
        this.settlementTimeout        = settlementTimeout;
    }

    public boolean enabled()                    { return enabled; }
    public Duration initialDelay()              { return initialDelay; }
    public Duration cycleInterval()             { return cycleInterval; }
    public Duration reflectionInterval()        { return reflectionInterval; }
    public Duration settlementInterval()        { return settlementInterval; }
    public Duration settlementActiveInterval()  { return settlementActiveInterval; }
    public Duration failureBackoff()            { return failureBackoff; }
    public Duration cycleTimeout()              { return cycleTimeout; }
    public Duration reflectionTimeout()         { return reflectionTimeout; }
    public Duration settlementTimeout()         { return settlementTimeout; }
}
