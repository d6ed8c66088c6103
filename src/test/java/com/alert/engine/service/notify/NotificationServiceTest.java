package com.alert.engine.service.notify;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AuditEntry;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.processor.ProcessOptions;
import com.alert.engine.service.support.EngineFixture;
import com.alert.engine.service.support.TestDefinitions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class NotificationServiceTest {

    private final EngineFixture fixture = new EngineFixture();
    private final AlertDefinition definition = TestDefinitions.lowStock("low")
            .notificationChannel("sms")
            .build();

    @Test
    void dispatch_deliversToEveryChannel() {
        Alert alert = alert();

        List<String> delivered = fixture.notificationService.dispatch(alert, definition).join();

        assertThat(delivered).containsExactly("email", "slack", "sms");
        assertThat(alert.getNotificationChannels()).containsExactly("email", "slack", "sms");
        assertThat(alert.getLastNotificationAt()).isEqualTo(EngineFixture.START);
        assertThat(alert.getAuditTrail()).extracting(AuditEntry::action).contains(AuditEntry.NOTIFICATIONS_SENT);
    }

    @Test
    void dispatch_isolatesFailingAndRejectingChannels() {
        fixture.dispatcher.throwOn("email");
        fixture.dispatcher.rejectOn("slack");
        Alert alert = alert();

        List<String> delivered = fixture.notificationService.dispatch(alert, definition).join();

        assertThat(delivered).containsExactly("sms");
        assertThat(alert.isNotificationsSent()).isTrue();
        assertThat(fixture.metricsCollector.snapshot().getNotificationDeliveryRate()).isCloseTo(1.0 / 3, within(1e-9));
    }

    @Test
    void dispatchEscalation_targetsEscalationRecipients() {
        Alert alert = alert();

        fixture.notificationService.dispatchEscalation(alert, definition, List.of("cto@company.com")).join();

        assertThat(fixture.dispatcher.escalations()).hasSize(3)
                .allSatisfy(delivery -> assertThat(delivery.recipients()).containsExactly("cto@company.com"));
        assertThat(alert.getNotificationChannels()).isEmpty();
    }

    @Test
    void loggingDispatcher_rejectsUnknownChannels() {
        LoggingNotificationDispatcher dispatcher = new LoggingNotificationDispatcher();
        Alert alert = alert();

        assertThat(dispatcher.send("EMAIL", alert, definition)).isTrue();
        assertThat(dispatcher.send("carrier-pigeon", alert, definition)).isFalse();
        assertThat(dispatcher.sendEscalation("pagerduty", alert, definition, List.of("oncall"))).isTrue();
    }

    private Alert alert() {
        return fixture.alertFactory.create(definition, Map.of("productId", "p1", "quantity", 3), ProcessOptions.defaults());
    }
}
