package com.yieldbasket.analysis.review;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.exception.MalformedModelOutputException;
import com.yieldbasket.common.exception.ProducerFailureException;
import com.yieldbasket.common.llm.CompletionClient;
import com.yieldbasket.common.llm.StructuredOutput;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ReportRequest;
import com.yieldbasket.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Optional language-model pass over a producer's rule-based report.
 *
 * <p>When no completion credentials are configured the baseline is returned unchanged.
 * When the model is consulted, its reply must parse into
 * {@code {"signal", "confidence", "evidence"}}; anything else becomes a
 * {@link ProducerFailureException}, never a silently trusted report.
 */
@Service
public class ModelReviewService {

    private static final Logger log = LoggerFactory.getLogger(ModelReviewService.class);

    private final CompletionClient completionClient;
    private final ObjectMapper objectMapper;

    public ModelReviewService(CompletionClient completionClient, ObjectMapper objectMapper) {
        this.completionClient = completionClient;
        this.objectMapper     = objectMapper;
    }

    public Mono<AnalystReport> review(AnalystReport baseline, ReportRequest request, Duration timeout) {
        if (!completionClient.isEnabled()) {
            return Mono.just(baseline);
        }
        return Mono.fromCallable(() -> buildPrompt(baseline, request))
            .flatMap(prompt -> completionClient.complete(prompt, timeout))
            .map(text -> parse(text, baseline))
            .doOnSuccess(r -> log.info("[ModelReview] producer={} baseline={}@{} reviewed={}@{} traceId={}",
                baseline.producer(), baseline.signal(), fmt(baseline.confidence()),
                r.signal(), fmt(r.confidence()), request.traceId()))
            .onErrorMap(MalformedModelOutputException.class,
                e -> new ProducerFailureException(baseline.producer(), "malformed model output: " + e.getMessage(), e));
    }

    AnalystReport parse(String text, AnalystReport baseline) {
        JsonNode json = StructuredOutput.parseObject(objectMapper, text);
        Signal signal = StructuredOutput.requireEnum(json, "signal", Signal.class);
        double confidence = StructuredOutput.requireUnitInterval(json, "confidence");
        List<String> evidence = new ArrayList<>(StructuredOutput.requireTextList(json, "evidence"));
        evidence.add("rule baseline " + baseline.signal() + "@" + fmt(baseline.confidence()));
        return new AnalystReport(baseline.producer(), confidence, signal, evidence,
                                 baseline.metrics(), null, Instant.now());
    }

    private String buildPrompt(AnalystReport baseline, ReportRequest request) throws Exception {
        return """
            You are the %s specialist reviewing a token basket before a rebalancing decision.
            A deterministic baseline produced this report:
            %s
            Basket weights: %s
            Basket NAV: %.2f
            Recent calibration notes: %s
            Reply with only a JSON object: {"signal": "BULLISH|BEARISH|NEUTRAL", "confidence": 0.0-1.0, "evidence": ["..."]}
            """.formatted(
                baseline.producer(),
                objectMapper.writeValueAsString(baseline),
                request.snapshot().weights(),
                request.snapshot().navUsd(),
                request.calibrationHints().stream().limit(3).map(h -> h.note()).toList());
    }

    private static String fmt(double d) {
        return String.format(Locale.ROOT, "%.2f", d);
    }
}
