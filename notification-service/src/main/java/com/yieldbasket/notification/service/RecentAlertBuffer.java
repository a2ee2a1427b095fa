package com.yieldbasket.notification.service;

import com.yieldbasket.common.model.Alert;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/** Bounded in-memory record of the most recent alerts, newest first. Lost on restart. */
@Component
public class RecentAlertBuffer {

    private final int         capacity;
    private final Deque<Alert> alerts = new ArrayDeque<>();

    public RecentAlertBuffer(@Value("${notification.recent-capacity:200}") int capacity) {
        if (capacity <= 0) throw new IllegalArgumentException("capacity must be positive");
        this.capacity = capacity;
    }

    public synchronized void record(Alert alert) {
        alerts.addFirst(alert);
        while (alerts.size() > capacity) {
            alerts.removeLast();
        }
    }

    public synchronized List<Alert> recent(int limit, Alert.Severity minSeverity) {
        List<Alert> out = new ArrayList<>();
        Iterator<Alert> it = alerts.iterator();
        while (it.hasNext() && out.size() < limit) {
            Alert a = it.next();
            if (minSeverity == null || (a.severity() != null && a.severity().compareTo(minSeverity) >= 0)) {
                out.add(a);
            }
        }
        return out;
    }
}
