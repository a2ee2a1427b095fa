package com.yieldbasket.analysis.producer;

import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;

import java.util.List;
import java.util.Locale;

/**
 * Scales a producer's raw confidence by its reflected track record.
 * Accuracy 0.5 leaves confidence unchanged; a perfect record lifts it by half.
 */
final class Calibration {

    static final double MIN_CONFIDENCE = 0.05;
    static final double MAX_CONFIDENCE = 0.95;

    private Calibration() {}

    static double adjust(double rawConfidence, ProducerKind kind, ReportRequest request) {
        double accuracy = request.meanAccuracyOf(kind);
        double scaled = Double.isNaN(accuracy) ? rawConfidence : rawConfidence * (0.5 + accuracy);
        return Math.max(MIN_CONFIDENCE, Math.min(MAX_CONFIDENCE, scaled));
    }

    static void describe(ProducerKind kind, ReportRequest request, List<String> evidence) {
        double accuracy = request.meanAccuracyOf(kind);
        if (!Double.isNaN(accuracy)) {
            evidence.add(String.format(Locale.ROOT, "calibration accuracy %.2f over %d hints",
                accuracy, request.calibrationHints().size()));
        }
    }
}
