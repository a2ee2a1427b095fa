package com.yieldbasket.orchestrator.debate;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.DebatePosition;
import com.yieldbasket.common.model.DebateThesis;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.common.weights.WeightMath;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Deterministic advocate used when no completion service is configured and as the
 * fallback for rejected model output.
 *
 * <p>Round one is drawn from the reports alone. From round two each side moves a quarter of
 * the way toward the opponent's latest confidence and restates its action; it never switches sides.
 */
@Component
public class RuleBasedAdvocate implements DebateAdvocate {

    static final double MIN_MEANINGFUL_CHANGE = 0.005;
    static final double HOLD_BASE_CONFIDENCE  = 0.55;
    static final double CONCESSION            = 0.25;
    static final double EXIT_RISK_CONFIDENCE  = 0.85;

    @Override
    public Mono<DebateThesis> argue(DebatePosition position, DebateContext context,
                                    List<DebateThesis> transcript, int round, String correction) {
        return Mono.fromSupplier(() -> {
            DebateThesis own      = DebateRules.lastOf(position, transcript);
            DebateThesis opponent = DebateRules.lastOf(position.opponent(), transcript);
            if (own == null || opponent == null) {
                return position == DebatePosition.ADVOCATE_FOR_CHANGE
                    ? openForChange(context, round)
                    : openForHold(context, round);
            }
            return concede(own, opponent, round);
        });
    }

    DebateThesis openForChange(DebateContext context, int round) {
        Signal direction = context.dominantSignal();
        int healthy = context.fanOut().healthy().size();
        List<String> evidence = new ArrayList<>();

        if (direction == Signal.NEUTRAL || healthy == 0) {
            evidence.add("no directional majority among " + healthy + " healthy reports");
            return new DebateThesis(DebatePosition.ADVOCATE_FOR_CHANGE, DecisionAction.HOLD, Map.of(), 0.3, evidence, round);
        }

        List<AnalystReport> agreeing = context.agreeing(direction);
        double meanConfidence = agreeing.stream().mapToDouble(AnalystReport::confidence).average().orElse(0.0);
        double share = agreeing.size() / (double) healthy;
        double confidence = clamp(meanConfidence * share);
        agreeing.forEach(r -> {
            if (!r.evidence().isEmpty()) evidence.add(r.producer() + ": " + r.evidence().get(0));
        });

        if (isExitCondition(context, direction)) {
            evidence.add("loss event with risk report bearish at or above " + EXIT_RISK_CONFIDENCE);
            return new DebateThesis(DebatePosition.ADVOCATE_FOR_CHANGE, DecisionAction.EMERGENCY_EXIT, Map.of(),
                                    confidence, evidence, round);
        }

        Map<String, Double> target = TargetWeightPlanner.plan(
            context.currentWeights(), context.trendMetrics(), direction, context.limits());
        double change = WeightMath.aggregateChange(context.currentWeights(), target);
        if (change < MIN_MEANINGFUL_CHANGE) {
            evidence.add(fmt("planned move %.4f below %.4f threshold", change, MIN_MEANINGFUL_CHANGE));
            return new DebateThesis(DebatePosition.ADVOCATE_FOR_CHANGE, DecisionAction.HOLD, Map.of(),
                                    clamp(confidence * 0.5), evidence, round);
        }
        evidence.add(fmt("%d of %d reports %s; planned aggregate change %.4f",
            agreeing.size(), healthy, direction, change));
        return new DebateThesis(DebatePosition.ADVOCATE_FOR_CHANGE, DecisionAction.REBALANCE, target,
                                confidence, evidence, round);
    }

    DebateThesis openForHold(DebateContext context, int round) {
        Signal direction = context.dominantSignal();
        int healthy = context.fanOut().healthy().size();
        long dissenting = healthy - context.agreeing(direction).size();
        double dissentShare = healthy == 0 ? 1.0 : dissenting / (double) healthy;
        double confidence = HOLD_BASE_CONFIDENCE + 0.3 * dissentShare;

        List<String> evidence = new ArrayList<>();
        evidence.add(fmt("%d of %d healthy reports do not support a %s move", dissenting, healthy, direction));

        context.fanOut().report(ProducerKind.RISK)
            .filter(r -> !r.isError() && r.signal() == Signal.BEARISH)
            .ifPresent(r -> evidence.add(fmt("risk report bearish at %.2f", r.confidence())));
        if (context.rebalancesLast24h() > 0) {
            confidence += 0.05 * context.rebalancesLast24h();
            evidence.add(context.rebalancesLast24h() + " rebalance(s) already executed in the last 24h");
        }
        int failed = context.fanOut().failedCount();
        if (failed > 0) {
            confidence += 0.05 * failed;
            evidence.add(failed + " producer(s) failed this cycle");
        }
        return new DebateThesis(DebatePosition.ADVOCATE_FOR_HOLD, DecisionAction.HOLD, Map.of(),
                                clamp(confidence), evidence, round);
    }

    DebateThesis concede(DebateThesis own, DebateThesis opponent, int round) {
        double moved = clamp(own.confidence() + CONCESSION * (opponent.confidence() - own.confidence()));
        List<String> evidence = new ArrayList<>(own.evidence());
        evidence.add(fmt("round %d: opponent at %.2f, restating %s at %.2f",
            round, opponent.confidence(), own.proposedAction(), moved));
        return new DebateThesis(own.position(), own.proposedAction(), own.targetWeights(), moved, evidence, round);
    }

    private static boolean isExitCondition(DebateContext context, Signal direction) {
        return direction == Signal.BEARISH
            && context.triggerReason() == TriggerReason.LOSS_EVENT
            && context.fanOut().report(ProducerKind.RISK)
                .filter(r -> !r.isError() && r.signal() == Signal.BEARISH && r.confidence() >= EXIT_RISK_CONFIDENCE)
                .isPresent();
    }

    private static double clamp(double confidence) {
        return Math.max(0.05, Math.min(0.95, confidence));
    }

    private static String fmt(String pattern, Object... args) {
        return String.format(Locale.ROOT, pattern, args);
    }
}
