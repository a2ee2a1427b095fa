package com.yieldbasket.settlement.client;

import com.yieldbasket.common.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

/** Fire-and-forget delivery to notification-service. Never blocks and never fails the caller. */
@Component
public class AlertClient {

    private static final Logger log = LoggerFactory.getLogger(AlertClient.class);

    private final WebClient notificationClient;

    public AlertClient(WebClient notificationClient) {
        this.notificationClient = notificationClient;
    }

    public void send(Alert alert) {
        notificationClient.post()
            .uri("/api/v1/alerts")
            .header("X-Trace-Id", alert.traceId() != null ? alert.traceId() : "")
            .bodyValue(alert)
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Alert delivered. title={} severity={} status={}",
                                alert.title(), alert.severity(), r.getStatusCode()),
                err -> log.warn("Alert delivery failed (non-critical). title={}", alert.title(), err)
            );
    }
}
