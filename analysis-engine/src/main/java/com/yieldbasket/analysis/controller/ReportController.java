package com.yieldbasket.analysis.controller;

import com.yieldbasket.analysis.service.ReportDispatchService;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

import java.util.List;

@RestController
@RequestMapping("/api/v1/reports")
public class ReportController {

    private final ReportDispatchService dispatchService;

    public ReportController(ReportDispatchService dispatchService) {
        this.dispatchService = dispatchService;
    }

    /** One producer. Always 200: producer failures come back as error-marked reports. */
    @PostMapping("/{kind}")
    public Mono<ResponseEntity<AnalystReport>> produce(@PathVariable ProducerKind kind,
                                                       @RequestBody ReportRequest request) {
        return dispatchService.dispatch(kind, request).map(ResponseEntity::ok);
    }

    @PostMapping
    public Mono<ResponseEntity<List<AnalystReport>>> produceAll(@RequestBody ReportRequest request) {
        return dispatchService.dispatchAll(request).map(ResponseEntity::ok);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }
}
