package com.yieldbasket.analysis.producer;

import com.yieldbasket.analysis.indicator.TechnicalIndicators;
import com.yieldbasket.common.exception.ProducerFailureException;
import com.yieldbasket.common.model.AnalystReport;
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
 * Market breadth as a sentiment proxy: the share of basket tokens with positive
 * short-term momentum. A sentiment-event trigger sharpens the call.
 */
@Component
public class SentimentProducer implements ReportProducer {

    private static final Logger log = LoggerFactory.getLogger(SentimentProducer.class);

    static final int LOOKBACK            = 7;
    static final double BULLISH_BREADTH  = 0.65;
    static final double BEARISH_BREADTH  = 0.35;
    static final double EVENT_BOOST      = 0.1;

    @Override
    public ProducerKind kind() { return ProducerKind.SENTIMENT; }

    @Override
    public AnalystReport produce(ReportRequest request) {
        int rising = 0;
        int measured = 0;
        double sumMomentum = 0;
        for (List<Double> closes : request.snapshot().priceHistory().values()) {
            double m = TechnicalIndicators.momentum(closes, LOOKBACK);
            if (Double.isNaN(m)) continue;
            measured++;
            sumMomentum += m;
            if (m > 0) rising++;
        }
        if (measured == 0) {
            throw new ProducerFailureException(kind(), "no token has " + (LOOKBACK + 1) + " closes of history");
        }
        log.info("[SentimentProducer] Analyzing tokens={} traceId={}", measured, request.traceId());

        double breadth = rising / (double) measured;
        double avgMomentum = sumMomentum / measured;

        List<String> evidence = new ArrayList<>();
        evidence.add(String.format(Locale.ROOT, "%d of %d tokens rising over %d closes", rising, measured, LOOKBACK));
        evidence.add(String.format(Locale.ROOT, "average momentum %+.2f%%", avgMomentum * 100));

        Signal signal;
        if (breadth >= BULLISH_BREADTH)      signal = Signal.BULLISH;
        else if (breadth <= BEARISH_BREADTH) signal = Signal.BEARISH;
        else                                 signal = Signal.NEUTRAL;

        double confidence = 0.4 + Math.abs(breadth - 0.5);
        if (request.triggerReason() == TriggerReason.SENTIMENT_EVENT && signal != Signal.NEUTRAL) {
            confidence += EVENT_BOOST;
            evidence.add("cycle triggered by a sentiment event");
        }

        Calibration.describe(kind(), request, evidence);
        return AnalystReport.of(kind(), Calibration.adjust(confidence, kind(), request), signal, evidence,
            Map.of("breadth", breadth, "avgMomentum", avgMomentum));
    }
}
