package com.alert.engine.service.support;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.notify.NotificationDispatcher;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Dispatcher that records deliveries. Channels can be made to throw or to reject.
 */
public class RecordingNotificationDispatcher implements NotificationDispatcher {

    public record Delivery(String channel, String alertId, boolean escalation, List<String> recipients) {
    }

    private final List<Delivery> deliveries = new CopyOnWriteArrayList<>();
    private final Set<String> throwingChannels = ConcurrentHashMap.newKeySet();
    private final Set<String> rejectingChannels = ConcurrentHashMap.newKeySet();

    public void throwOn(String channel) {
        throwingChannels.add(channel);
    }

    public void rejectOn(String channel) {
        rejectingChannels.add(channel);
    }

    public List<Delivery> deliveries() {
        return List.copyOf(deliveries);
    }

    public List<Delivery> escalations() {
        return deliveries.stream().filter(Delivery::escalation).toList();
    }

    @Override
    public boolean send(String channel, Alert alert, AlertDefinition definition) {
        return deliver(new Delivery(channel, alert.getId(), false, definition.getRecipients()));
    }

    @Override
    public boolean sendEscalation(String channel, Alert alert, AlertDefinition definition, List<String> recipients) {
        return deliver(new Delivery(channel, alert.getId(), true, recipients));
    }

    private boolean deliver(Delivery delivery) {
        if (throwingChannels.contains(delivery.channel())) {
            throw new IllegalStateException(delivery.channel() + " is unavailable");
        }
        if (rejectingChannels.contains(delivery.channel())) {
            return false;
        }
        deliveries.add(delivery);
        return true;
    }
}
