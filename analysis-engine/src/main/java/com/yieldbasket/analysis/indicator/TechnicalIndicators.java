package com.yieldbasket.analysis.indicator;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pure calculation utilities over close series.
 * Input series are expected newest-first (index 0 = most recent close).
 */
public final class TechnicalIndicators {

    private TechnicalIndicators() {}

    // ── RSI ─────────────────────────────────────────────────────────────────

    /**
     * RSI with Wilder's smoothing.
     *
     * @return 0–100, or NaN if fewer than {@code period + 1} closes
     */
    public static double rsi(List<Double> closes, int period) {
        if (closes == null || closes.size() < period + 1) return Double.NaN;
        List<Double> oldest = oldestFirst(closes);
        int n = oldest.size();

        double avgGain = 0;
        double avgLoss = 0;
        for (int i = 1; i <= period; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            if (change > 0) avgGain += change;
            else avgLoss += Math.abs(change);
        }
        avgGain /= period;
        avgLoss /= period;

        for (int i = period + 1; i < n; i++) {
            double change = oldest.get(i) - oldest.get(i - 1);
            avgGain = (avgGain * (period - 1) + Math.max(change, 0)) / period;
            avgLoss = (avgLoss * (period - 1) + Math.max(-change, 0)) / period;
        }

        if (avgLoss == 0) return 100.0;
        double rs = avgGain / avgLoss;
        return 100.0 - (100.0 / (1.0 + rs));
    }

    // ── moving averages ─────────────────────────────────────────────────────

    public static double sma(List<Double> closes, int period) {
        if (closes == null || closes.size() < period || period <= 0) return Double.NaN;
        double sum = 0;
        for (int i = 0; i < period; i++) sum += closes.get(i);
        return sum / period;
    }

    // ── dispersion ──────────────────────────────────────────────────────────

    /** Population standard deviation of simple period-over-period returns. */
    public static double returnVolatility(List<Double> closes, int period) {
        List<Double> returns = returns(closes);
        if (returns.size() < period || period <= 1) return Double.NaN;
        double mean = 0;
        for (int i = 0; i < period; i++) mean += returns.get(i);
        mean /= period;
        double variance = 0;
        for (int i = 0; i < period; i++) {
            double diff = returns.get(i) - mean;
            variance += diff * diff;
        }
        return Math.sqrt(variance / period);
    }

    /** Simple returns, newest-first; one element shorter than the input. */
    public static List<Double> returns(List<Double> closes) {
        List<Double> out = new ArrayList<>();
        if (closes == null) return out;
        for (int i = 0; i + 1 < closes.size(); i++) {
            double prev = closes.get(i + 1);
            if (prev != 0.0) out.add((closes.get(i) - prev) / prev);
        }
        return out;
    }

    /** Fractional change from {@code lookback} closes ago to now, NaN if the series is too short. */
    public static double momentum(List<Double> closes, int lookback) {
        if (closes == null || closes.size() <= lookback || lookback <= 0) return Double.NaN;
        double then = closes.get(lookback);
        return then == 0.0 ? Double.NaN : (closes.get(0) - then) / then;
    }

    /** Drop of the latest close below the highest close in the window, as a fraction. */
    public static double drawdownFromHigh(List<Double> closes, int window) {
        if (closes == null || closes.isEmpty()) return Double.NaN;
        double high = closes.subList(0, Math.min(window, closes.size())).stream()
            .mapToDouble(Double::doubleValue).max().orElse(closes.get(0));
        return high <= 0.0 ? 0.0 : (high - closes.get(0)) / high;
    }

    // ── signal helpers ──────────────────────────────────────────────────────

    public static String trendSignal(double smaFast, double smaSlow, double current) {
        if (Double.isNaN(smaFast) || Double.isNaN(smaSlow)) return "INSUFFICIENT_DATA";
        if (current > smaFast && smaFast > smaSlow) return "UPTREND";
        if (current < smaFast && smaFast < smaSlow) return "DOWNTREND";
        return "SIDEWAYS";
    }

    private static List<Double> oldestFirst(List<Double> closes) {
        List<Double> copy = new ArrayList<>(closes);
        Collections.reverse(copy);
        return copy;
    }
}
