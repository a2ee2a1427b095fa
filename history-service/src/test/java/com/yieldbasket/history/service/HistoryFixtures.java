package com.yieldbasket.history.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.DecisionAction;
import com.yieldbasket.common.model.ExecutionStatus;
import com.yieldbasket.common.model.ProducerKind;
import com.yieldbasket.common.model.Signal;
import com.yieldbasket.common.model.TriggerReason;
import com.yieldbasket.history.config.HistoryConfig;
import com.yieldbasket.history.model.DecisionRecord;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

final class HistoryFixtures {

    static final ObjectMapper MAPPER = new HistoryConfig().objectMapper();

    private HistoryFixtures() {}

    static Decision decision(String id, DecisionAction action, Instant createdAt) {
        List<AnalystReport> reports = List.of(
            AnalystReport.of(ProducerKind.TREND, 0.8, Signal.BULLISH, List.of("SOL momentum"), Map.of()),
            AnalystReport.of(ProducerKind.LIQUIDITY, 0.5, Signal.NEUTRAL, List.of("depth stable"), Map.of()),
            AnalystReport.failed(ProducerKind.SENTIMENT, "timeout after 8000ms"),
            AnalystReport.of(ProducerKind.RISK, 0.6, Signal.BEARISH, List.of("drawdown rising"), Map.of()));
        Map<String, Double> prior = Map.of("USDC", 0.2, "SOL", 0.4, "ETH", 0.4);
        Map<String, Double> next  = action == DecisionAction.REBALANCE
            ? Map.of("USDC", 0.2, "SOL", 0.5, "ETH", 0.3)
            : prior;
        return new Decision(id, "trace-" + id, TriggerReason.SCHEDULED, action, prior, next, 0.7, 0.0001,
            reports, List.of(), null, ExecutionStatus.NOT_REQUIRED, null, List.of("test"),
            1_000_000, Map.of("USDC", 1.0, "SOL", 100.0, "ETH", 2000.0), createdAt);
    }

    static DecisionRecord record(Decision decision, boolean reflected) throws Exception {
        DecisionRecord record = new DecisionRecord();
        record.setId(1L);
        record.setDecisionId(decision.decisionId());
        record.setTraceId(decision.traceId());
        record.setAction(decision.action().name());
        record.setExecutionStatus(decision.executionStatus().name());
        record.setNavAtDecision(decision.navAtDecision());
        record.setPayload(MAPPER.writeValueAsString(decision));
        record.setReflected(reflected);
        record.setCreatedAt(LocalDateTime.ofInstant(decision.createdAt(), ZoneOffset.UTC));
        return record;
    }
}
