package com.yieldbasket.orchestrator.debate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.exception.MalformedModelOutputException;
import com.yieldbasket.common.llm.CompletionClient;
import com.yieldbasket.common.llm.StructuredOutput;
import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.weights.WeightMath;
import com.yieldbasket.orchestrator.config.DebateProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Language-model advocate. Each call sees the reports, the current basket, the limits and the
 * whole transcript from both sides.
 *
 * <p>Replies are schema-checked with {@link StructuredOutput}; a malformed reply or a failed call
 * falls back to {@link RuleBasedAdvocate} for that round and the fallback is noted in the evidence.
 */
@Primary
@Component
public class ModelAdvocate implements DebateAdvocate {

    private static final Logger log = LoggerFactory.getLogger(ModelAdvocate.class);

    static final double WEIGHT_TOLERANCE = 1e-3;

    private final CompletionClient completionClient;
    private final RuleBasedAdvocate fallback;
    private final ObjectMapper objectMapper;
    private final DebateProperties properties;

    public ModelAdvocate(CompletionClient completionClient, RuleBasedAdvocate fallback,
                         ObjectMapper objectMapper, DebateProperties properties) {
        this.completionClient = completionClient;
        this.fallback         = fallback;
        this.objectMapper     = objectMapper;
        this.properties       = properties;
    }

    @Override
    public Mono<DebateThesis> argue(DebatePosition position, DebateContext context,
                                    List<DebateThesis> transcript, int round, String correction) {
        if (!completionClient.isEnabled()) {
            return fallback.argue(position, context, transcript, round, correction);
        }
        return Mono.fromCallable(() -> buildPrompt(position, context, transcript, round, correction))
            .flatMap(prompt -> completionClient.complete(prompt, properties.roundTimeout()))
            .map(text -> parse(text, position, round))
            .doOnSuccess(t -> log.info("[Debate] Model thesis. position={} round={} action={} confidence={} traceId={}",
                position, round, t.proposedAction(), t.confidence(), context.traceId()))
            .onErrorResume(e -> {
                log.warn("[Debate] Model advocate failed, using rule baseline. position={} round={} reason={} traceId={}",
                    position, round, e.getMessage(), context.traceId());
                return fallback.argue(position, context, transcript, round, correction)
                    .map(t -> withNote(t, "model output rejected: " + e.getMessage()));
            });
    }

    DebateThesis parse(String text, DebatePosition position, int round) {
        JsonNode json = StructuredOutput.parseObject(objectMapper, text);
        DecisionAction action = StructuredOutput.requireEnum(json, "proposedAction", DecisionAction.class);
        if (action == DecisionAction.SKIPPED) {
            throw new MalformedModelOutputException("SKIPPED is not a debatable action");
        }
        double confidence = StructuredOutput.requireUnitInterval(json, "confidence");
        List<String> evidence = StructuredOutput.requireTextList(json, "evidence");
        Map<String, Double> weights = Map.of();
        if (action == DecisionAction.REBALANCE) {
            weights = WeightMath.normalize(
                StructuredOutput.requireWeights(json, "targetWeights", true, WEIGHT_TOLERANCE));
        }
        return new DebateThesis(position, action, weights, confidence, evidence, round);
    }

    private String buildPrompt(DebatePosition position, DebateContext context,
                               List<DebateThesis> transcript, int round, String correction) throws Exception {
        String role = position == DebatePosition.ADVOCATE_FOR_CHANGE
            ? "argue for changing the basket composition"
            : "argue for keeping the basket unchanged";
        String retry = correction == null ? "" : """

            Your previous answer for this round was rejected: %s
            If you change your proposed action you must cite evidence not already present in the transcript.
            """.formatted(correction);
        return """
            You are one side of a structured debate about a token basket. Your role: %s.
            Round %d of at most %d.

            Current weights: %s
            Basket NAV: %.2f
            Limits: max token weight %.2f, anchor %s floor %.2f, max aggregate change %.2f, max token churn %d
            Analyst reports: %s
            Transcript so far (both sides): %s
            %s
            Reply with only a JSON object:
            {"proposedAction": "REBALANCE|HOLD|EMERGENCY_EXIT", "targetWeights": {"TOKEN": 0.0}, "confidence": 0.0-1.0, "evidence": ["..."]}
            targetWeights are required for REBALANCE and must sum to 1.0.
            """.formatted(
                role, round, properties.maxRounds(),
                context.currentWeights(), context.snapshot().navUsd(),
                context.limits().maxTokenWeight(), context.limits().anchorToken(), context.limits().anchorFloor(),
                context.limits().maxAggregateChange(), context.limits().maxTokenChurn(),
                objectMapper.writeValueAsString(context.fanOut().reports()),
                objectMapper.writeValueAsString(transcript),
                retry);
    }

    private static DebateThesis withNote(DebateThesis thesis, String note) {
        List<String> evidence = new ArrayList<>(thesis.evidence());
        evidence.add(note);
        return new DebateThesis(thesis.position(), thesis.proposedAction(), thesis.targetWeights(),
                                thesis.confidence(), evidence, thesis.round());
    }
}
