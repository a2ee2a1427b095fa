package com.yieldbasket.analysis.producer;

import com.yieldbasket.analysis.indicator.TechnicalIndicators;
import com.yieldbasket.common.exception.ProducerFailureException;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import com.yieldbasket.common.model.Signal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the basket NAV trend (fast/slow SMA alignment, RSI extremes, short momentum)
 * and publishes per-token momentum as {@code momentum:<TOKEN>} metrics.
 */
@Component
public class TrendProducer implements ReportProducer {

    private static final Logger log = LoggerFactory.getLogger(TrendProducer.class);

    static final int FAST_PERIOD       = 10;
    static final int SLOW_PERIOD       = 30;
    static final int RSI_PERIOD        = 14;
    static final int MOMENTUM_LOOKBACK = 7;

    @Override
    public ProducerKind kind() { return ProducerKind.TREND; }

    @Override
    public AnalystReport produce(ReportRequest request) {
        BasketSnapshot snapshot = request.snapshot();
        List<Double> nav = snapshot.navHistory();
        if (nav.isEmpty()) {
            throw new ProducerFailureException(kind(), "no NAV history in snapshot");
        }
        log.info("[TrendProducer] Analyzing navCloses={} traceId={}", nav.size(), request.traceId());

        Map<String, Double> metrics = new HashMap<>();
        snapshot.priceHistory().forEach((token, closes) -> {
            double m = TechnicalIndicators.momentum(closes, MOMENTUM_LOOKBACK);
            if (!Double.isNaN(m)) metrics.put("momentum:" + token, m);
        });

        if (nav.size() < SLOW_PERIOD) {
            return AnalystReport.of(kind(), 0.1, Signal.NEUTRAL,
                List.of("insufficient NAV history: " + nav.size() + " closes"), metrics);
        }

        double current = nav.get(0);
        double smaFast = TechnicalIndicators.sma(nav, FAST_PERIOD);
        double smaSlow = TechnicalIndicators.sma(nav, SLOW_PERIOD);
        double rsi     = TechnicalIndicators.rsi(nav, RSI_PERIOD);
        double navMom  = TechnicalIndicators.momentum(nav, MOMENTUM_LOOKBACK);
        String trend   = TechnicalIndicators.trendSignal(smaFast, smaSlow, current);

        List<String> evidence = new ArrayList<>();
        int bullish = 0;
        int bearish = 0;

        if ("UPTREND".equals(trend))   { bullish++; evidence.add("NAV above fast SMA above slow SMA"); }
        if ("DOWNTREND".equals(trend)) { bearish++; evidence.add("NAV below fast SMA below slow SMA"); }

        if (!Double.isNaN(rsi)) {
            if (rsi > 70)      { bearish++; evidence.add(String.format(Locale.ROOT, "RSI %.1f overbought", rsi)); }
            else if (rsi < 30) { bullish++; evidence.add(String.format(Locale.ROOT, "RSI %.1f oversold", rsi)); }
        }

        if (!Double.isNaN(navMom)) {
            if (navMom > 0) bullish++; else bearish++;
            evidence.add(String.format(Locale.ROOT, "%d-close NAV momentum %+.2f%%", MOMENTUM_LOOKBACK, navMom * 100));
        }

        Signal signal;
        double confidence;
        if (bullish > bearish) {
            signal = Signal.BULLISH;
            confidence = 0.4 + 0.15 * bullish;
        } else if (bearish > bullish) {
            signal = Signal.BEARISH;
            confidence = 0.4 + 0.15 * bearish;
        } else {
            signal = Signal.NEUTRAL;
            confidence = 0.35;
        }

        Calibration.describe(kind(), request, evidence);
        metrics.put("smaFast", smaFast);
        metrics.put("smaSlow", smaSlow);
        if (!Double.isNaN(rsi)) metrics.put("rsi", rsi);

        return AnalystReport.of(kind(), Calibration.adjust(confidence, kind(), request), signal, evidence, metrics);
    }
}
