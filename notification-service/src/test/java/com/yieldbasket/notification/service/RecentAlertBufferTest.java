package com.yieldbasket.notification.service;

import com.yieldbasket.common.model.Alert;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class RecentAlertBufferTest {

    private static Alert alert(String title, Alert.Severity severity) {
        return new Alert("test", severity, title, null, null, Instant.EPOCH);
    }

    @Test
    void newestFirstAndBounded() {
        RecentAlertBuffer buffer = new RecentAlertBuffer(3);
        for (int i = 1; i <= 5; i++) {
            buffer.record(alert("a" + i, Alert.Severity.INFO));
        }

        List<Alert> recent = buffer.recent(10, null);

        assertThat(recent).extracting(Alert::title).containsExactly("a5", "a4", "a3");
    }

    @Test
    void limitAndSeverityFilter() {
        RecentAlertBuffer buffer = new RecentAlertBuffer(10);
        buffer.record(alert("info", Alert.Severity.INFO));
        buffer.record(alert("warn", Alert.Severity.WARNING));
        buffer.record(alert("crit", Alert.Severity.CRITICAL));

        assertThat(buffer.recent(10, Alert.Severity.WARNING)).extracting(Alert::title)
            .containsExactly("crit", "warn");
        assertThat(buffer.recent(1, null)).extracting(Alert::title).containsExactly("crit");
    }

    @Test
    void rejectsNonPositiveCapacity() {
        assertThrows(IllegalArgumentException.class, () -> new RecentAlertBuffer(0));
    }
}
