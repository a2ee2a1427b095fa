package com.yieldbasket.orchestrator.controller;

import com.yieldbasket.common.model.CycleTriggerEvent;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.orchestrator.service.OrchestratorService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequestMapping("/api/v1/orchestrate")
public class OrchestratorController {

    private final OrchestratorService orchestratorService;

    public OrchestratorController(OrchestratorService orchestratorService) {
        this.orchestratorService = orchestratorService;
    }

    /** Runs one cycle to completion. 409 when another cycle is already running. */
    @PostMapping("/trigger")
    public Mono<ResponseEntity<Decision>> trigger(@RequestBody CycleTriggerEvent event) {
        return orchestratorService.runCycle(event).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
