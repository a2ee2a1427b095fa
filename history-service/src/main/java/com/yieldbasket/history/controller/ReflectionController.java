package com.yieldbasket.history.controller;

import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.history.service.ReflectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1")
public class ReflectionController {

    private static final Logger log = LoggerFactory.getLogger(ReflectionController.class);

    private final ReflectionService reflectionService;

    public ReflectionController(ReflectionService reflectionService) {
        this.reflectionService = reflectionService;
    }

    @GetMapping("/calibration/hints")
    public Flux<CalibrationHint> hints(@RequestParam(defaultValue = "10") int limit) {
        return reflectionService.latestHints(limit).flatMapMany(Flux::fromIterable);
    }

    @PostMapping("/reflection/run")
    public Mono<List<CalibrationHint>> sweep() {
        log.info("Reflection sweep requested");
        return reflectionService.sweep();
    }

    @PostMapping("/reflection/run/{decisionId}")
    public Mono<CalibrationHint> reflect(@PathVariable String decisionId) {
        log.info("Reflection requested. decisionId={}", decisionId);
        return reflectionService.reflect(decisionId);
    }
}
