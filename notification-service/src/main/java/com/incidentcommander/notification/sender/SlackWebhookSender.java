package com.incidentcommander.notification.sender;

import com.incidentcommander.common.model.DispatchFailure;
import com.incidentcommander.common.model.EscalationRecord;
import com.incidentcommander.common.model.Finding;
import com.incidentcommander.common.model.IncidentPriority;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.util.Map;

@Component
public class SlackWebhookSender {

    private static final Logger log = LoggerFactory.getLogger(SlackWebhookSender.class);

    private final WebClient webClient;
    private final String slackWebhookUrl;
    private final boolean slackEnabled;

    public SlackWebhookSender(WebClient.Builder builder,
                              @Value("${notification.slack.webhook-url:}") String slackWebhookUrl,
                              @Value("${notification.slack.enabled:false}") boolean slackEnabled) {
        this.webClient = builder.build();
        this.slackWebhookUrl = slackWebhookUrl == null ? "" : slackWebhookUrl;
        this.slackEnabled = slackEnabled;
    }

    /** @return {@code true} if a webhook post was started, {@code false} if only logged */
    public boolean sendEscalation(EscalationRecord record) {
        String incidentId = record.incident().id();
        if (!slackEnabled || slackWebhookUrl.isBlank()) {
            log.info("Slack disabled. Logging escalation. incident={} priority={} reason={} findings={} failures={} | {}",
                     incidentId, record.priority(), record.reason(),
                     record.findings().size(), record.failures().size(), record.summary());
            return false;
        }

        String message = buildEscalationMessage(record);

        webClient.post()
            .uri(slackWebhookUrl)
            .bodyValue(Map.of("text", message))
            .retrieve()
            .toBodilessEntity()
            .subscribe(
                r   -> log.info("Slack escalation sent. incident={} status={}", incidentId, r.getStatusCode()),
                err -> log.error("Slack escalation failed. incident={}", incidentId, err)
            );
        return true;
    }

    String buildEscalationMessage(EscalationRecord record) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("*%s %s escalation: %s* | `incident: %s`%n",
                                priorityEmoji(record.priority()), record.priority(),
                                record.incident().category(), record.incident().id()));
        sb.append(String.format("*Reason:* `%s`%n", record.reason()));
        sb.append(String.format("_%s_%n", record.summary()));
        if (record.decision() != null) {
            sb.append(String.format("*Consensus:* `%s` at %.0f%% (threshold %.0f%%)%n",
                                    record.decision().winningAction(),
                                    record.decision().weightedConfidence() * 100,
                                    record.decision().threshold() * 100));
        }
        if (record.rollback() != null) {
            sb.append(String.format("*Rollback:* %s%n", record.rollback()));
        }
        sb.append("---\n");

        for (Finding f : record.findings()) {
            sb.append(String.format("• *%s* (round %d) → `%s` (conf: %.0f%%)\n",
                f.role(), f.round(), f.recommendedAction(), f.confidence() * 100));
            if (!f.summary().isBlank()) {
                sb.append(String.format("   _%s_%n", f.summary()));
            }
        }
        for (DispatchFailure failure : record.failures()) {
            sb.append(String.format("✖ *%s* (round %d) %s: %s\n",
                failure.role(), failure.round(), failure.kind(), failure.detail()));
        }
        return sb.toString();
    }

    private String priorityEmoji(IncidentPriority priority) {
        return switch (priority) {
            case P1 -> "🔴";
            case P2 -> "🟠";
            case P3 -> "🟡";
            default -> "⚪";
        };
    }
}
