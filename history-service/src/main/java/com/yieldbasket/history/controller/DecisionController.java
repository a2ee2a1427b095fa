package com.yieldbasket.history.controller;

import com.yieldbasket.common.model.Decision;
import com.yieldbasket.history.service.DecisionHistoryService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/decisions")
public class DecisionController {

    private static final Logger log = LoggerFactory.getLogger(DecisionController.class);

    private final DecisionHistoryService historyService;

    public DecisionController(DecisionHistoryService historyService) {
        this.historyService = historyService;
    }

    @PostMapping
    public Mono<Decision> save(@RequestBody Decision decision) {
        log.info("Received decision for persistence. decisionId={} action={} traceId={}",
                 decision.decisionId(), decision.action(), decision.traceId());
        return historyService.save(decision);
    }

    @GetMapping
    public Flux<Decision> latest(@RequestParam(defaultValue = "30") int limit) {
        return historyService.latest(limit).flatMapMany(Flux::fromIterable);
    }

    @GetMapping("/{decisionId}")
    public Mono<ResponseEntity<Decision>> byId(@PathVariable String decisionId) {
        return historyService.findById(decisionId)
            .map(ResponseEntity::ok)
            .defaultIfEmpty(ResponseEntity.notFound().build());
    }

    @GetMapping(value = "/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Decision>> stream() {
        log.info("SSE decision stream client connected");
        return historyService.stream()
            .map(decision -> ServerSentEvent.<Decision>builder()
                .id(decision.decisionId())
                .event("decision")
                .data(decision)
                .build());
    }
}
