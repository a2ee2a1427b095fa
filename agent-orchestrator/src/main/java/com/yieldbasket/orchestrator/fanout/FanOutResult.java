package com.yieldbasket.orchestrator.fanout;

import com.yieldbasket.common.model.AnalystReport;
import com.yieldbasket.common.model.ProducerKind;

import java.util.List;
import java.util.Optional;

/** All four reports for a cycle, in {@link ProducerKind} order, failures included. */
public record FanOutResult(List<AnalystReport> reports) {

    public static final int DEGRADED_THRESHOLD = 2;

    public FanOutResult {
        reports = List.copyOf(reports);
    }

    public int failedCount() {
        return (int) reports.stream().filter(AnalystReport::isError).count();
    }

    public boolean degraded() {
        return failedCount() >= DEGRADED_THRESHOLD;
    }

    public List<AnalystReport> healthy() {
        return reports.stream().filter(r -> !r.isError()).toList();
    }

    public Optional<AnalystReport> report(ProducerKind kind) {
        return reports.stream().filter(r -> r.producer() == kind).findFirst();
    }

    public List<String> errorNotes() {
        return reports.stream().filter(AnalystReport::isError)
            .map(r -> "producer " + r.producer() + " failed: " + r.error())
            .toList();
    }
}
