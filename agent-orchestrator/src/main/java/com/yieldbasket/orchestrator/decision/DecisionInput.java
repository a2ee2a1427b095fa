package com.yieldbasket.orchestrator.decision;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.CalibrationHint;
import com.yieldbasket.common.model.Decision;
import com.yieldbasket.common.model.RiskVerdict;
import com.yieldbasket.orchestrator.debate.DebateOutcome;

import java.util.List;
import java.util.Map;

public record DecisionInput(
    DebateOutcome debate,
    RiskVerdict verdict,
    List<AnalystReport> reports,
    Map<String, Double> currentWeights,
    double navUsd,
    List<CalibrationHint> calibrationHints,
    List<Decision> recentDecisions
) {}
