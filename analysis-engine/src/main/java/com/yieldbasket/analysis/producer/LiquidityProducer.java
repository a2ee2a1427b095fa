package com.yieldbasket.analysis.producer;

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
import java.util.TreeMap;

/**
 * Compares each held position with the market depth available to exit it.
 * Coverage is depth divided by position value; thin coverage argues against moving.
 */
@Component
public class LiquidityProducer implements ReportProducer {

    private static final Logger log = LoggerFactory.getLogger(LiquidityProducer.class);

    static final double THIN_COVERAGE  = 20.0;
    static final double AMPLE_COVERAGE = 100.0;
    static final double MIN_WEIGHT     = 0.01;

    @Override
    public ProducerKind kind() { return ProducerKind.LIQUIDITY; }

    @Override
    public AnalystReport produce(ReportRequest request) {
        BasketSnapshot snapshot = request.snapshot();
        if (snapshot.liquidityUsd().isEmpty()) {
            throw new ProducerFailureException(kind(), "no liquidity data in snapshot");
        }
        log.info("[LiquidityProducer] Analyzing tokens={} traceId={}", snapshot.weights().size(), request.traceId());

        Map<String, Double> metrics = new HashMap<>();
        List<String> evidence = new ArrayList<>();
        int thin = 0;
        int ample = 0;
        int held = 0;

        for (Map.Entry<String, Double> e : new TreeMap<>(snapshot.weights()).entrySet()) {
            if (e.getValue() <= MIN_WEIGHT) continue;
            held++;
            double position = e.getValue() * snapshot.navUsd();
            double depth = snapshot.liquidityUsd().getOrDefault(e.getKey(), 0.0);
            double coverage = position > 0 ? depth / position : Double.POSITIVE_INFINITY;
            metrics.put("coverage:" + e.getKey(), Math.min(coverage, 1e9));
            if (coverage < THIN_COVERAGE) {
                thin++;
                evidence.add(String.format(Locale.ROOT, "%s depth covers position only %.1fx", e.getKey(), coverage));
            } else if (coverage >= AMPLE_COVERAGE) {
                ample++;
            }
        }

        Signal signal;
        double confidence;
        if (thin > 0) {
            signal = Signal.BEARISH;
            confidence = Math.min(0.5 + 0.1 * thin, 0.9);
        } else if (held > 0 && ample == held) {
            signal = Signal.BULLISH;
            confidence = 0.6;
            evidence.add("every held token has at least " + (int) AMPLE_COVERAGE + "x depth coverage");
        } else {
            signal = Signal.NEUTRAL;
            confidence = 0.5;
            evidence.add("depth adequate, not ample");
        }

        Calibration.describe(kind(), request, evidence);
        return AnalystReport.of(kind(), Calibration.adjust(confidence, kind(), request), signal, evidence, metrics);
    }
}
