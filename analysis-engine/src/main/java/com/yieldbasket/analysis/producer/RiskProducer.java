package com.yieldbasket.analysis.producer;

import com.yieldbasket.analysis.indicator.TechnicalIndicators;
import com.yieldbasket.common.exception.ProducerFailureException;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.model.TriggerReason;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Scores basket risk from NAV return volatility, drawdown from the recent high and
 * weight concentration (Herfindahl index). This report doubles as the risk gate's
 * soft-risk input.
 */
@Component
public class RiskProducer implements ReportProducer {

    private static final Logger log = LoggerFactory.getLogger(RiskProducer.class);

    static final int VOL_PERIOD            = 20;
    static final double HIGH_VOLATILITY    = 0.03;
    static final double ELEVATED_VOLATILITY = 0.015;
    static final double DRAWDOWN_THRESHOLD = 0.05;
    static final double CONCENTRATION_HHI  = 0.30;

    @Override
    public ProducerKind kind() { return ProducerKind.RISK; }

    @Override
    public AnalystReport produce(ReportRequest request) {
        BasketSnapshot snapshot = request.snapshot();
        List<Double> nav = snapshot.navHistory();
        if (nav.size() < 2) {
            throw new ProducerFailureException(kind(), "need at least 2 NAV closes, got " + nav.size());
        }
        log.info("[RiskProducer] Analyzing navCloses={} traceId={}", nav.size(), request.traceId());

        double volatility = TechnicalIndicators.returnVolatility(nav, Math.min(VOL_PERIOD, nav.size() - 1));
        double drawdown   = TechnicalIndicators.drawdownFromHigh(nav, VOL_PERIOD);
        double hhi        = snapshot.weights().values().stream().mapToDouble(w -> w * w).sum();

        List<String> evidence = new ArrayList<>();
        int points = 0;

        if (!Double.isNaN(volatility)) {
            if (volatility > HIGH_VOLATILITY) points += 2;
            else if (volatility > ELEVATED_VOLATILITY) points += 1;
            evidence.add(String.format(Locale.ROOT, "NAV return volatility %.2f%%", volatility * 100));
        }
        if (drawdown > DRAWDOWN_THRESHOLD) {
            points += 2;
            evidence.add(String.format(Locale.ROOT, "drawdown %.2f%% from %d-close high", drawdown * 100, VOL_PERIOD));
        }
        if (hhi > CONCENTRATION_HHI) {
            points += 1;
            evidence.add(String.format(Locale.ROOT, "concentration HHI %.3f", hhi));
        }
        if (request.triggerReason() == TriggerReason.LOSS_EVENT) {
            points += 1;
            evidence.add("cycle triggered by a loss event");
        }

        Signal signal;
        double confidence;
        if (points >= 3) {
            signal = Signal.BEARISH;
            confidence = Math.min(0.5 + 0.1 * points, 0.95);
        } else if (points == 0) {
            signal = Signal.BULLISH;
            confidence = 0.55;
            evidence.add("risk budget available");
        } else {
            signal = Signal.NEUTRAL;
            confidence = 0.45;
        }

        Calibration.describe(kind(), request, evidence);
        return AnalystReport.of(kind(), Calibration.adjust(confidence, kind(), request), signal, evidence, Map.of(
            "volatility", Double.isNaN(volatility) ? 0.0 : volatility,
            "drawdown",   drawdown,
            "hhi",        hhi,
            "riskPoints", (double) points));
    }
}
