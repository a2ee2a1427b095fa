package com.yieldbasket.analysis.producer;

import com.yieldbasket.common.exception.ProducerFailureException;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.BasketSnapshot;
import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.ReportRequest;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.model.TriggerReason;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ReportProducersTest {

    private static final Map<String, Double> WEIGHTS = Map.of("USDC", 0.10, "SOL", 0.30, "ETH", 0.30, "BTC", 0.30);

    private static List<Double> series(int n, double start, double step) {
        List<Double> closes = new ArrayList<>();
        for (int i = n - 1; i >= 0; i--) closes.add(start + step * i);
        return closes;
    }

    private static ReportRequest request(List<Double> nav, Map<String, Double> liquidity,
                                         Map<String, List<Double>> prices, TriggerReason reason,
                                         List<CalibrationHint> hints) {
        BasketSnapshot snapshot = new BasketSnapshot(WEIGHTS, 1_000_000, liquidity, prices, nav, Instant.now());
        return new ReportRequest(snapshot, hints, reason, "trace-test");
    }

    private static Map<String, List<Double>> prices(double step) {
        return Map.of(
            "USDC", series(10, 1.0, 0.0),
            "SOL", series(10, 100, step),
            "ETH", series(10, 2000, step * 10),
            "BTC", series(10, 50000, step * 100));
    }

    // ── trend ──────────────────────────────────────────────────────────────

    @Nested
    class Trend {

        private final TrendProducer producer = new TrendProducer();

        @Test
        @DisplayName("steady NAV climb reads bullish and exposes per-token momentum")
        void risingNavIsBullish() {
            AnalystReport report = producer.produce(
                request(series(40, 100, 1), Map.of(), prices(1), TriggerReason.SCHEDULED, List.of()));

            assertEquals(Signal.BULLISH, report.signal());
            assertThat(report.metrics()).containsKeys("momentum:SOL", "momentum:ETH", "smaFast", "smaSlow");
            assertThat(report.metrics().get("momentum:SOL")).isPositive();
        }

        @Test
        @DisplayName("short history yields a low-confidence neutral report rather than failing")
        void shortHistoryIsNeutral() {
            AnalystReport report = producer.produce(
                request(series(5, 100, 1), Map.of(), Map.of(), TriggerReason.SCHEDULED, List.of()));

            assertEquals(Signal.NEUTRAL, report.signal());
            assertEquals(0.1, report.confidence(), 1e-9);
        }

        @Test
        void missingHistoryFails() {
            assertThrows(ProducerFailureException.class, () -> producer.produce(
                request(List.of(), Map.of(), Map.of(), TriggerReason.SCHEDULED, List.of())));
        }

        @Test
        @DisplayName("poor calibration record lowers confidence")
        void calibrationScalesConfidence() {
            ReportRequest plain = request(series(40, 100, 1), Map.of(), prices(1), TriggerReason.SCHEDULED, List.of());
            CalibrationHint poor = new CalibrationHint("d-1", Map.of(ProducerKind.TREND, 0.1), -0.02, "missed", Instant.now());
            ReportRequest calibrated = request(series(40, 100, 1), Map.of(), prices(1), TriggerReason.SCHEDULED, List.of(poor));

            assertThat(producer.produce(calibrated).confidence())
                .isLessThan(producer.produce(plain).confidence());
        }
    }

    // ── liquidity ──────────────────────────────────────────────────────────

    @Nested
    class Liquidity {

        private final LiquidityProducer producer = new LiquidityProducer();

        @Test
        void thinDepthIsBearish() {
            Map<String, Double> depth = Map.of("USDC", 9e9, "SOL", 1_000_000.0, "ETH", 9e9, "BTC", 9e9);
            AnalystReport report = producer.produce(
                request(series(3, 100, 1), depth, Map.of(), TriggerReason.SCHEDULED, List.of()));

            assertEquals(Signal.BEARISH, report.signal());
            assertThat(report.evidence()).anyMatch(e -> e.startsWith("SOL depth covers"));
        }

        @Test
        void ampleDepthIsBullish() {
            Map<String, Double> depth = Map.of("USDC", 9e9, "SOL", 9e9, "ETH", 9e9, "BTC", 9e9);
            AnalystReport report = producer.produce(
                request(series(3, 100, 1), depth, Map.of(), TriggerReason.SCHEDULED, List.of()));

            assertEquals(Signal.BULLISH, report.signal());
        }

        @Test
        void missingDepthFails() {
            assertThrows(ProducerFailureException.class, () -> producer.produce(
                request(series(3, 100, 1), Map.of(), Map.of(), TriggerReason.SCHEDULED, List.of())));
        }
    }

    // ── sentiment ──────────────────────────────────────────────────────────

    @Nested
    class Sentiment {

        private final SentimentProducer producer = new SentimentProducer();

        @Test
        void broadDeclineIsBearish() {
            AnalystReport report = producer.produce(
                request(series(3, 100, 1), Map.of(), prices(-1), TriggerReason.SCHEDULED, List.of()));
            assertEquals(Signal.BEARISH, report.signal());
        }

        @Test
        void broadAdvanceIsBullish() {
            AnalystReport report = producer.produce(
                request(series(3, 100, 1), Map.of(), prices(1), TriggerReason.SCHEDULED, List.of()));
            assertEquals(Signal.BULLISH, report.signal());
        }

        @Test
        void nothingMeasurableFails() {
            assertThrows(ProducerFailureException.class, () -> producer.produce(
                request(series(3, 100, 1), Map.of(), Map.of(), TriggerReason.SCHEDULED, List.of())));
        }
    }

    // ── risk ───────────────────────────────────────────────────────────────

    @Nested
    class Risk {

        private final RiskProducer producer = new RiskProducer();

        @Test
        @DisplayName("deep drawdown on a loss event reads bearish")
        void drawdownIsBearish() {
            List<Double> nav = new ArrayList<>(List.of(80.0, 85.0, 90.0, 95.0, 100.0));
            AnalystReport report = producer.produce(
                request(nav, Map.of(), Map.of(), TriggerReason.LOSS_EVENT, List.of()));
            assertEquals(Signal.BEARISH, report.signal());
        }

        @Test
        void singleCloseFails() {
            assertThrows(ProducerFailureException.class, () -> producer.produce(
                request(List.of(100.0), Map.of(), Map.of(), TriggerReason.SCHEDULED, List.of())));
        }
    }
}
