package com.alert.engine.service.notify;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;

import java.util.List;

/**
 * Delivers alert notifications to one channel at a time.
 *
 * A {@code false} result or an exception counts as a failure of that channel only.
 */
public interface NotificationDispatcher {

    boolean send(String channel, Alert alert, AlertDefinition definition);

    boolean sendEscalation(String channel, Alert alert, AlertDefinition definition, List<String> recipients);
}
