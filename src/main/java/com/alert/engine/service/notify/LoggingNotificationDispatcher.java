package com.alert.engine.service.notify;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Dispatcher that writes notifications to the log. Unknown channels are rejected.
 */
@Slf4j
@Component
public class LoggingNotificationDispatcher implements NotificationDispatcher {

    static final Set<String> SUPPORTED_CHANNELS = Set.of("email", "slack", "sms", "webhook", "pagerduty");

    @Override
    public boolean send(String channel, Alert alert, AlertDefinition definition) {
        if (!isSupported(channel)) {
            log.warn("Unsupported notification channel '{}' for alert {}", channel, alert.getId());
            return false;
        }
        log.info("[{}] {} -> {} ({} priority, severity {})", channel, alert.getTitle(),
                definition.getRecipients(), alert.getPriority(), alert.getSeverity());
        return true;
    }

    @Override
    public boolean sendEscalation(String channel, Alert alert, AlertDefinition definition, List<String> recipients) {
        if (!isSupported(channel)) {
            log.warn("Unsupported escalation channel '{}' for alert {}", channel, alert.getId());
            return false;
        }
        log.info("[{}] ESCALATION level {}: {} -> {}", channel, alert.getEscalationLevel(),
                alert.getTitle(), recipients);
        return true;
    }

    private static boolean isSupported(String channel) {
        return channel != null && SUPPORTED_CHANNELS.contains(channel.toLowerCase(Locale.ROOT));
    }
}
