package com.yieldbasket.settlement.controller;

import com.yieldbasket.settlement.model.BridgeEvent;
import com.yieldbasket.settlement.model.BridgeJob;
import com.yieldbasket.settlement.model.CreateJobRequest;
import com.yieldbasket.settlement.model.StepResult;
import com.yieldbasket.settlement.model.TriggerResult;
import com.yieldbasket.settlement.service.BridgeEventLog;
import com.yieldbasket.settlement.service.BridgeStateMachine;
import com.yieldbasket.settlement.trigger.BridgeTriggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/bridge")
public class BridgeJobController {

    private static final Logger log = LoggerFactory.getLogger(BridgeJobController.class);

    private final BridgeStateMachine stateMachine;
    private final BridgeTriggerService triggerService;
    private final BridgeEventLog eventLog;

    public BridgeJobController(BridgeStateMachine stateMachine,
                               BridgeTriggerService triggerService,
                               BridgeEventLog eventLog) {
        this.stateMachine   = stateMachine;
        this.triggerService = triggerService;
        this.eventLog       = eventLog;
    }

    // ── queries ─────────────────────────────────────────────────────────────

    @GetMapping("/jobs")
    public Flux<BridgeJob> jobs(@RequestParam(defaultValue = "20") int limit) {
        return stateMachine.latest(limit);
    }

    @GetMapping("/jobs/pending")
    public Flux<BridgeJob> pending() {
        return stateMachine.pending();
    }

    @GetMapping("/jobs/{id}")
    public Mono<BridgeJob> job(@PathVariable long id) {
        return stateMachine.findJob(id);
    }

    @GetMapping("/jobs/{id}/events")
    public Flux<BridgeEvent> events(@PathVariable long id) {
        return stateMachine.findJob(id).flatMapMany(job -> eventLog.forJob(id));
    }

    @GetMapping(value = "/events/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<BridgeEvent>> stream() {
        log.info("SSE bridge event stream client connected");
        return eventLog.stream()
            .map(event -> ServerSentEvent.<BridgeEvent>builder()
                .id(String.valueOf(event.getId()))
                .event("bridge-transition")
                .data(event)
                .build());
    }

    // ── job creation ────────────────────────────────────────────────────────

    @PostMapping("/jobs")
    public Mono<BridgeJob> create(@RequestBody CreateJobRequest request) {
        log.info("Manual bridge job requested. amountRaw={} reason={}", request.amountRaw(), request.reason());
        return triggerService.createManual(request.amountRaw(), request.reason());
    }

    @PostMapping("/trigger/evaluate")
    public Mono<TriggerResult> evaluateTrigger() {
        return triggerService.evaluate();
    }

    // ── driving and operator actions ────────────────────────────────────────

    @PostMapping("/jobs/{id}/advance")
    public Mono<StepResult> advance(@PathVariable long id) {
        return stateMachine.advance(id);
    }

    @PostMapping("/jobs/{id}/resume")
    public Mono<BridgeJob> resume(@PathVariable long id) {
        return stateMachine.resume(id);
    }

    @PostMapping("/jobs/advance-pending")
    public Flux<StepResult> advancePending() {
        return stateMachine.advanceAllPending();
    }

    @PostMapping("/jobs/{id}/retry")
    public Mono<BridgeJob> retry(@PathVariable long id, @RequestParam(defaultValue = "false") boolean force) {
        log.warn("Bridge job retry requested. job={} force={}", id, force);
        return stateMachine.retry(id, force);
    }

    @PostMapping("/jobs/{id}/cancel")
    public Mono<BridgeJob> cancel(@PathVariable long id, @RequestParam(required = false) String reason) {
        return stateMachine.cancel(id, reason);
    }
}
