package com.yieldbasket.common.reflection;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.weights.WeightMath;

import java.util.EnumMap;
import java.util.HashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Scores a past decision against what the market did afterwards.
 * Pure logic: no repositories, no clients, no logging.
 *
 * <p>A producer is correct when its direction matches the sign of the realized NAV move
 * outside a {@value #NEUTRAL_BAND} band, or when it called NEUTRAL and the move stayed
 * inside it. Accuracy is {@code 0.5 + confidence/2} when correct, {@code 0.5 - confidence/2}
 * when wrong, so a confident miss scores lower than a timid one. Errored reports are skipped.
 */
public final class ReflectionScorer {

    public static final double NEUTRAL_BAND = 0.005;

    private ReflectionScorer() {}

    public static ReflectionResult score(Decision decision, double currentNav, Map<String, Double> currentPrices) {
        double navChange = decision.navAtDecision() > 0.0
            ? (currentNav - decision.navAtDecision()) / decision.navAtDecision()
            : 0.0;

        Map<ProducerKind, Double> accuracy = new EnumMap<>(ProducerKind.class);
        for (AnalystReport report : decision.reports()) {
            if (report.isError()) continue;
            boolean correct = isCorrect(report.signal(), navChange);
            double half = report.confidence() / 2.0;
            accuracy.put(report.producer(), correct ? 0.5 + half : 0.5 - half);
        }

        double edge = decisionEdge(decision, currentPrices);

        ProducerKind best = null;
        ProducerKind worst = null;
        for (Map.Entry<ProducerKind, Double> e : accuracy.entrySet()) {
            if (best == null || e.getValue() > accuracy.get(best)) best = e.getKey();
            if (worst == null || e.getValue() < accuracy.get(worst)) worst = e.getKey();
        }

        String note = best == null
            ? String.format(Locale.ROOT, "nav %+.2f%%; no producer reported successfully", navChange * 100)
            : String.format(Locale.ROOT, "nav %+.2f%%; best=%s (%.2f) worst=%s (%.2f); %s edge %+.2f%%",
                navChange * 100, best, accuracy.get(best), worst, accuracy.get(worst),
                decision.action().name().toLowerCase(Locale.ROOT), edge * 100);

        return new ReflectionResult(Map.copyOf(accuracy), navChange, edge, best, worst, note);
    }

    static boolean isCorrect(Signal signal, double navChange) {
        return switch (signal) {
            case BULLISH -> navChange > NEUTRAL_BAND;
            case BEARISH -> navChange < -NEUTRAL_BAND;
            case NEUTRAL -> Math.abs(navChange) <= NEUTRAL_BAND;
        };
    }

    /** Per-token realized return weighted by the change the decision made; zero for HOLD. */
    static double decisionEdge(Decision decision, Map<String, Double> currentPrices) {
        Set<String> tokens = new HashSet<>(decision.finalWeights().keySet());
        tokens.addAll(decision.priorWeights().keySet());
        double edge = 0.0;
        for (String token : tokens) {
            Double then = decision.pricesAtDecision().get(token);
            Double now  = currentPrices.get(token);
            if (then == null || now == null || then <= 0.0) continue;
            double tokenReturn = (now - then) / then;
            double delta = WeightMath.weightOf(decision.finalWeights(), token)
                         - WeightMath.weightOf(decision.priorWeights(), token);
            edge += delta * tokenReturn;
        }
        return edge;
    }
}
