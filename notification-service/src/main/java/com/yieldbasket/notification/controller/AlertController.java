package com.yieldbasket.notification.controller;

import com.yieldbasket.common.model.Alert;
import com.yieldbasket.notification.sender.SlackWebhookSender;
import com.yieldbasket.notification.service.RecentAlertBuffer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/v1/alerts")
public class AlertController {

    private static final Logger log = LoggerFactory.getLogger(AlertController.class);
    private static final int MAX_LIMIT = 200;

    private final SlackWebhookSender slackSender;
    private final RecentAlertBuffer  recentAlerts;

    public AlertController(SlackWebhookSender slackSender, RecentAlertBuffer recentAlerts) {
        this.slackSender  = slackSender;
        this.recentAlerts = recentAlerts;
    }

    @PostMapping
    public ResponseEntity<Map<String, Object>> receive(
            @RequestBody Alert alert,
            @RequestHeader(value = "X-Trace-Id", required = false) String traceHeader) {
        if (alert.title() == null || alert.title().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of(
                "error_code", "INVALID_ALERT",
                "message",    "alert title is required",
                "timestamp",  Instant.now().toString()));
        }
        Alert normalized = normalize(alert, traceHeader);
        recentAlerts.record(normalized);
        boolean forwarded = slackSender.send(normalized);
        log.debug("[Alert] received title={} severity={} forwarded={}",
                  normalized.title(), normalized.severity(), forwarded);
        return ResponseEntity.accepted().body(Map.of("accepted", true, "forwarded", forwarded));
    }

    @GetMapping("/recent")
    public List<Alert> recent(@RequestParam(defaultValue = "50") int limit,
                              @RequestParam(required = false) Alert.Severity minSeverity) {
        return recentAlerts.recent(Math.max(1, Math.min(limit, MAX_LIMIT)), minSeverity);
    }

    @GetMapping("/health")
    public ResponseEntity<String> health() {
        return ResponseEntity.ok("OK");
    }

    static Alert normalize(Alert alert, String traceHeader) {
        String traceId = alert.traceId() != null && !alert.traceId().isBlank()
            ? alert.traceId()
            : (traceHeader != null && !traceHeader.isBlank() ? traceHeader : null);
        return new Alert(
            alert.source(),
            alert.severity() != null ? alert.severity() : Alert.Severity.INFO,
            alert.title(),
            alert.detail(),
            traceId,
            alert.raisedAt() != null ? alert.raisedAt() : Instant.now());
    }
}
