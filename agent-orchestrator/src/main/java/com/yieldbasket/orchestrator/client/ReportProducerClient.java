package com.yieldbasket.orchestrator.client;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

/** One HTTP call per producer kind against the analysis engine. */
@Component
public class ReportProducerClient {

    private final WebClient analysisEngineClient;

    public ReportProducerClient(WebClient analysisEngineClient) {
        this.analysisEngineClient = analysisEngineClient;
    }

    public Mono<AnalystReport> produce(ProducerKind kind, ReportRequest request) {
        return analysisEngineClient.post()
            .uri("/api/v1/reports/{kind}", kind)
            .header("X-Trace-Id", request.traceId())
            .bodyValue(request)
            .retrieve()
            .bodyToMono(AnalystReport.class);
    }
}
