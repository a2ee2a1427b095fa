package com.yieldbasket.orchestrator.controller;

import com.yieldbasket.common.safety.SafetyStatus;
import com.yieldbasket.orchestrator.safety.SafetySystem;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

/** Out-of-band safety controls. The settlement service polls {@code /status} before bridging. */
@RestController
@RequestMapping("/api/v1/safety")
public class SafetyController {

    private final SafetySystem safetySystem;

    public SafetyController(SafetySystem safetySystem) {
        this.safetySystem = safetySystem;
    }

    @GetMapping("/status")
    public ResponseEntity<SafetyStatus> status() {
        return ResponseEntity.ok(safetySystem.status());
    }

    @PostMapping("/kill-switch/engage")
    public Mono<ResponseEntity<SafetyStatus>> engage(@RequestParam String reason) {
        if (reason.isBlank()) {
            throw new IllegalArgumentException("reason is required");
        }
        return safetySystem.engageKillSwitch(reason).map(ResponseEntity::ok);
    }

    @PostMapping("/kill-switch/release")
    public Mono<ResponseEntity<SafetyStatus>> release() {
        return safetySystem.releaseKillSwitch().map(ResponseEntity::ok);
    }

    @PostMapping("/loss-halt/clear")
    public Mono<ResponseEntity<SafetyStatus>> clearLossHalt() {
        return safetySystem.clearLossHalt().map(ResponseEntity::ok);
    }
}
