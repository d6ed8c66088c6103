package com.alert.engine.service.notify;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.metrics.MetricsCollector;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Fans an alert out to its definition's channels on the notification executor.
 *
 * Each channel is attempted independently; a failing channel is logged and left out of the
 * alert's delivered channels.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NotificationService {

    private final NotificationDispatcher dispatcher;
    private final MetricsCollector metricsCollector;
    private final Clock clock;

    /**
     * Sends the alert to every configured channel.
     *
     * @return the channels that accepted the notification
     */
    @Async("notificationExecutor")
    public CompletableFuture<List<String>> dispatch(Alert alert, AlertDefinition definition) {
        List<String> delivered = new ArrayList<>();
        for (String channel : definition.getNotificationChannels()) {
            if (attempt(channel, alert, () -> dispatcher.send(channel, alert, definition))) {
                delivered.add(channel);
            }
        }
        alert.recordNotifications(delivered, definition.getRecipients().size(), clock.instant());
        log.debug("Alert {} delivered to {}/{} channels", alert.getId(), delivered.size(),
                definition.getNotificationChannels().size());
        return CompletableFuture.completedFuture(delivered);
    }

    /**
     * Sends an escalation notice to the escalation recipients on every configured channel.
     */
    @Async("notificationExecutor")
    public CompletableFuture<List<String>> dispatchEscalation(Alert alert, AlertDefinition definition,
                                                              List<String> recipients) {
        List<String> delivered = new ArrayList<>();
        for (String channel : definition.getNotificationChannels()) {
            if (attempt(channel, alert, () -> dispatcher.sendEscalation(channel, alert, definition, recipients))) {
                delivered.add(channel);
            }
        }
        log.debug("Escalation of alert {} delivered to {}", alert.getId(), delivered);
        return CompletableFuture.completedFuture(delivered);
    }

    // --- Private helpers ---

    private boolean attempt(String channel, Alert alert, ChannelSend send) {
        boolean ok;
        try {
            ok = send.send();
            if (!ok) {
                log.warn("Notification channel {} rejected alert {}", channel, alert.getId());
            }
        } catch (RuntimeException e) {
            log.warn("Notification channel {} failed for alert {}: {}", channel, alert.getId(), e.getMessage());
            ok = false;
        }
        metricsCollector.recordNotification(ok);
        return ok;
    }

    @FunctionalInterface
    private interface ChannelSend {
        boolean send();
    }
}
