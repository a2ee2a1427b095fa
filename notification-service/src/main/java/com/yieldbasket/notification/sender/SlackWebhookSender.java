package com.yieldbasket.notification.sender;

import com.yieldbasket.common.model.Alert;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.time.format.DateTimeFormatter;
import java.util.Map;

/**
 * Posts alerts to a Slack incoming webhook.
 *
 * <p>When Slack is disabled or no webhook is configured the alert is written to the log
 * at a level matching its severity. Delivery is fire-and-forget; a failed post is logged
 * and never surfaces to the service that raised the alert.
 */
@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private final WebClient webClient;
    private final String    slackWebhookUrl;
    private final boolean   slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder,
                              @Value("${notification.slack.webhook-url:}") String slackWebhookUrl,
                              @Value("${notification.slack.enabled:false}") boolean slackEnabled) {
        this.webClient       = builder.build();
        this.slackWebhookUrl = slackWebhookUrl == null ? "" : slackWebhookUrl;
        this.slackEnabled    = slackEnabled;
    }

    /** @return true when the alert was handed to Slack, false when it was only logged */
    public boolean send(Alert alert) {
        if (!isEnabled()) {
            logAlert(alert);
            return false;
        }

        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", buildSlackMessage(alert)))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Slack alert sent. traceId={} title={} status={}",
                                alert.traceId(), alert.title(), r.getStatusCode()),
                err -> log.error("Slack alert failed. traceId={} title={}", alert.traceId(), alert.title(), err)
            );
        return true;
    }

    public boolean isEnabled() {
        return slackEnabled && !slackWebhookUrl.isBlank();
    }

    static String buildSlackMessage(Alert alert) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("%s *[%s] %s*", severityEmoji(alert.severity()),
                                alert.severity(), alert.title()));
        if (alert.source() != null) {
            sb.append(String.format(" | `%s`", alert.source()));
        }
        sb.append('\n');
        if (alert.detail() != null && !alert.detail().isBlank()) {
            sb.append(String.format("> %s%n", alert.detail()));
        }
        if (alert.traceId() != null && !alert.traceId().isBlank()) {
            sb.append(String.format("`traceId: %s`", alert.traceId()));
        }
        if (alert.raisedAt() != null) {
            sb.append(String.format(" _raised %s_", DateTimeFormatter.ISO_INSTANT.format(alert.raisedAt())));
        }
        return sb.toString().stripTrailing();
    }

    static String severityEmoji(Alert.Severity severity) {
        if (severity == null) return "⚪";
        return switch (severity) {
            case CRITICAL -> "🔴";
            case WARNING  -> "🟡";
            case INFO     -> "⚪";
        };
    }

    private void logAlert(Alert alert) {
        Alert.Severity severity = alert.severity() == null ? Alert.Severity.INFO : alert.severity();
        switch (severity) {
            case CRITICAL -> log.error("[Alert] severity=CRITICAL source={} title={} detail={} traceId={}",
                                       alert.source(), alert.title(), alert.detail(), alert.traceId());
            case WARNING  -> log.warn("[Alert] severity=WARNING source={} title={} detail={} traceId={}",
                                      alert.source(), alert.title(), alert.detail(), alert.traceId());
            default       -> log.info("[Alert] severity=INFO source={} title={} detail={} traceId={}",
                                      alert.source(), alert.title(), alert.detail(), alert.traceId());
        }
    }
}
