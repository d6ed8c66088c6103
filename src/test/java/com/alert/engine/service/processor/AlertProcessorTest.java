package com.alert.engine.service.processor;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertLifecycleManager;
import com.alert.engine.service.alert.AlertProcessingException;
import com.alert.engine.service.alert.AlertStatus;
import com.alert.engine.service.alert.DeduplicationIndex;
import com.alert.engine.service.definition.ActiveSchedule;
import com.alert.engine.service.definition.AlertType;
import com.alert.engine.service.definition.ThrottlingConfig;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import com.alert.engine.service.notify.SecurityEvent;
import com.alert.engine.service.support.EngineFixture;
import com.alert.engine.service.support.TestDefinitions;
import com.alert.engine.service.throttle.ThrottlingEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalTime;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AlertProcessorTest {

    private final EngineFixture fixture = new EngineFixture();

    private static Map<String, Object> lowStockEvent(String productId, int quantity) {
        return Map.of("productId", productId, "storeId", "s1", "quantity", quantity);
    }

    private static Map<String, Object> outOfStockEvent() {
        return Map.of("productId", "p1", "storeId", "s1", "quantity", 0, "productName", "Widget");
    }

    @Nested
    class Selection {

        @Test
        void noDefinitionForType_yieldsNoAlert() {
            fixture.register(TestDefinitions.lowStock("low").build());

            assertThat(fixture.processor.process(AlertType.PRICE_CHANGE, Map.of("priceChangePercent", 30))).isEmpty();
            assertThat(fixture.alertStore.count()).isZero();
        }

        @Test
        void conditionsNotMet_yieldsNoAlert() {
            fixture.register(TestDefinitions.lowStock("low").build());

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 40))).isEmpty();
            assertThat(fixture.metricsCollector.snapshot().getTotalAlertsGenerated()).isZero();
        }

        @Test
        void disabledEngine_yieldsNoAlert() {
            fixture.register(TestDefinitions.lowStock("low").build());
            fixture.engineConfig.setEnabled(false);

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3))).isEmpty();
        }

        @Test
        void firstEnabledDefinitionWins() {
            fixture.register(
                    TestDefinitions.lowStock("disabled").enabled(false).build(),
                    TestDefinitions.lowStock("first").build(),
                    TestDefinitions.lowStock("second").build());

            String alertId = fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3)).orElseThrow();

            assertThat(fixture.processor.findAlert(alertId).orElseThrow().getDefinitionId()).isEqualTo("first");
        }

        @Test
        void outsideActiveHours_dropsEventUnlessForced() {
            fixture.register(TestDefinitions.lowStock("office-hours")
                    .schedule(ActiveSchedule.builder().start(LocalTime.of(8, 0)).end(LocalTime.of(9, 0)).build())
                    .build());

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3))).isEmpty();
            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3),
                    ProcessOptions.builder().forceProcess(true).build())).isPresent();
        }
    }

    @Nested
    class Throttling {

        @Test
        @DisplayName("Sixth event in the hour is suppressed, the next hour admits again")
        void timeWindowCap() {
            fixture.register(TestDefinitions.lowStock("low").build());
            for (int i = 0; i < 5; i++) {
                assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p" + i, 3))).isPresent();
                fixture.clock.advance(Duration.ofMinutes(1));
            }

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p5", 3))).isEmpty();

            fixture.clock.advance(Duration.ofHours(1));
            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p6", 3))).isPresent();

            assertThat(fixture.metricsCollector.snapshot().getAlertsThrottled()).isEqualTo(1);
            assertThat(fixture.alertStore.count()).isEqualTo(6);
        }

        @Test
        void cooldown() {
            fixture.register(TestDefinitions.lowStock("cooldown")
                    .throttlingStrategy(ThrottlingStrategyType.COUNT_BASED)
                    .throttlingConfig(ThrottlingConfig.builder().cooldownPeriod(Duration.ofMinutes(15)).build())
                    .build());

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3))).isPresent();
            fixture.clock.advance(Duration.ofMinutes(10));
            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p2", 3))).isEmpty();
            fixture.clock.advance(Duration.ofMinutes(10));
            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p3", 3))).isPresent();
        }

        @Test
        void bypassThrottling_admitsPastTheCap() {
            fixture.register(TestDefinitions.lowStock("low")
                    .throttlingConfig(ThrottlingConfig.builder().maxAlertsInWindow(1).build())
                    .build());
            fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3));

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p2", 3))).isEmpty();
            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p2", 3),
                    ProcessOptions.builder().bypassThrottling(true).build())).isPresent();
        }
    }

    @Nested
    class Deduplication {

        @Test
        @DisplayName("Identical out-of-stock events fold into one alert")
        void duplicateEvent_returnsExistingAlert() {
            fixture.register(TestDefinitions.outOfStock("oos").build());

            String first = fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();
            fixture.clock.advance(Duration.ofMinutes(5));
            String second = fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();

            assertThat(second).isEqualTo(first);
            Alert alert = fixture.processor.findAlert(first).orElseThrow();
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(alert.getOriginalCount()).isEqualTo(2);
            assertThat(alert.getRelatedAlerts()).hasSize(1);
            assertThat(fixture.alertStore.count()).isEqualTo(1);
            assertThat(fixture.dispatcher.deliveries()).hasSize(1);
            assertThat(fixture.metricsCollector.snapshot().getAlertsDeduplicated()).isEqualTo(1);
        }

        @Test
        void duplicateTakesPrecedenceOverWindowLimit() {
            fixture.register(TestDefinitions.outOfStock("oos")
                    .throttlingConfig(ThrottlingConfig.builder().maxAlertsInWindow(1).build())
                    .build());

            String first = fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();

            assertThat(fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent())).contains(first);
            assertThat(fixture.metricsCollector.snapshot().getAlertsThrottled()).isZero();
        }

        @Test
        void resolvedAlert_allowsFreshAlert() {
            fixture.register(TestDefinitions.outOfStock("oos").build());
            String first = fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();
            fixture.lifecycleManager.resolve(first, "restocked", "ops");

            Optional<String> next = fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent());

            assertThat(next).isPresent().isNotEqualTo(Optional.of(first));
        }

        @Test
        void targetResolvedAfterLookup_admitsFreshAlert() {
            fixture.register(TestDefinitions.outOfStock("oos").build());
            String first = fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();
            AlertProcessor racing = fixture.processorWith(new ThrottlingEngine(
                    new ResolvingLookupIndex(fixture.deduplicationIndex, fixture.lifecycleManager),
                    List.of(fixture.timeBased)));

            String second = racing.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();

            assertThat(second).isNotEqualTo(first);
            assertThat(fixture.processor.findAlert(first).orElseThrow().getStatus()).isEqualTo(AlertStatus.RESOLVED);
            assertThat(fixture.processor.findAlert(second).orElseThrow().getStatus()).isEqualTo(AlertStatus.ACTIVE);
            assertThat(fixture.metricsCollector.snapshot().getAlertsDeduplicated()).isZero();
            assertThat(fixture.stateStore.find("oos").orElseThrow().getCountInWindow()).isEqualTo(2);
        }

        @Test
        void targetResolvedAfterLookup_stillHonoursWindowLimit() {
            fixture.register(TestDefinitions.outOfStock("oos")
                    .throttlingConfig(ThrottlingConfig.builder().maxAlertsInWindow(1).build())
                    .build());
            fixture.processor.process(AlertType.OUT_OF_STOCK, outOfStockEvent()).orElseThrow();
            AlertProcessor racing = fixture.processorWith(new ThrottlingEngine(
                    new ResolvingLookupIndex(fixture.deduplicationIndex, fixture.lifecycleManager),
                    List.of(fixture.timeBased)));

            assertThat(racing.process(AlertType.OUT_OF_STOCK, outOfStockEvent())).isEmpty();
            assertThat(fixture.metricsCollector.snapshot().getAlertsThrottled()).isEqualTo(1);
            assertThat(fixture.alertStore.count()).isEqualTo(1);
        }
    }

    /**
     * Resolves every live hit right after it is looked up, as an operator acting between lookup and merge would.
     */
    private static final class ResolvingLookupIndex implements DeduplicationIndex {

        private final DeduplicationIndex delegate;
        private final AlertLifecycleManager lifecycleManager;

        ResolvingLookupIndex(DeduplicationIndex delegate, AlertLifecycleManager lifecycleManager) {
            this.delegate = delegate;
            this.lifecycleManager = lifecycleManager;
        }

        @Override
        public Optional<Alert> findDuplicate(String definitionId, String fingerprint, Instant since) {
            Optional<Alert> hit = delegate.findDuplicate(definitionId, fingerprint, since);
            hit.ifPresent(alert -> lifecycleManager.resolve(alert.getId(), "restocked", "ops"));
            return hit;
        }

        @Override
        public void register(Alert alert) {
            delegate.register(alert);
        }

        @Override
        public void unregister(Alert alert) {
            delegate.unregister(alert);
        }

        @Override
        public int prune(Instant cutoff) {
            return delegate.prune(cutoff);
        }

        @Override
        public int size() {
            return delegate.size();
        }
    }

    @Nested
    class SideEffects {

        @Test
        void admittedAlert_isNotifiedAndForwarded() {
            fixture.register(TestDefinitions.lowStock("low").build());

            String alertId = fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3)).orElseThrow();

            Alert alert = fixture.processor.findAlert(alertId).orElseThrow();
            assertThat(alert.getNotificationChannels()).containsExactly("email", "slack");
            assertThat(alert.isNotificationsSent()).isTrue();
            assertThat(alert.getDetails()).containsEntry("stockSeverity", "CRITICAL");
            assertThat(fixture.securityEventSink.events()).singleElement()
                    .extracting(SecurityEvent::getAlertId).isEqualTo(alertId);
        }

        @Test
        void failingChannel_doesNotStopOtherChannels() {
            fixture.register(TestDefinitions.lowStock("low").build());
            fixture.dispatcher.throwOn("email");

            String alertId = fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3)).orElseThrow();

            assertThat(fixture.processor.findAlert(alertId).orElseThrow().getNotificationChannels())
                    .containsExactly("slack");
            assertThat(fixture.metricsCollector.snapshot().getNotificationDeliveryRate()).isEqualTo(0.5);
        }

        @Test
        void failingSecuritySink_doesNotFailProcessing() {
            fixture.register(TestDefinitions.lowStock("low").build());
            fixture.securityEventSink.failWith(true);

            assertThat(fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3))).isPresent();
        }

        @Test
        void severeAlert_isEscalatedImmediately() {
            fixture.register(TestDefinitions.lowStock("severe").severity(9).build());

            String alertId = fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3)).orElseThrow();

            Alert alert = fixture.processor.findAlert(alertId).orElseThrow();
            assertThat(alert.getStatus()).isEqualTo(AlertStatus.ESCALATED);
            assertThat(alert.getEscalationLevel()).isEqualTo(1);
            assertThat(fixture.dispatcher.escalations()).hasSize(2)
                    .allSatisfy(delivery -> assertThat(delivery.recipients()).containsExactly("manager@company.com"));
        }

        @Test
        void immediateEscalationCanBeDisabled() {
            fixture.register(TestDefinitions.lowStock("severe").severity(10).build());
            fixture.engineConfig.getFeatures().setImmediateEscalationEnabled(false);

            String alertId = fixture.processor.process(AlertType.LOW_STOCK, lowStockEvent("p1", 3)).orElseThrow();

            assertThat(fixture.processor.findAlert(alertId).orElseThrow().getStatus()).isEqualTo(AlertStatus.ACTIVE);
        }
    }

    @Nested
    class Failures {

        @Test
        void unserializableDedupField_raisesFingerprintFailure() {
            fixture.register(TestDefinitions.outOfStock("oos").build());
            Map<String, Object> data = new HashMap<>(outOfStockEvent());
            data.put("productId", new Object());

            assertThatThrownBy(() -> fixture.processor.process(AlertType.OUT_OF_STOCK, data))
                    .isInstanceOf(AlertProcessingException.class)
                    .extracting("errorCode")
                    .isEqualTo(AlertProcessingException.FINGERPRINT_FAILED);
            assertThat(fixture.alertStore.count()).isZero();
        }

        @Test
        void systemStateForUnknownDefinition_isRejected() {
            assertThatThrownBy(() -> fixture.processor.recordSystemState("missing", "abc", Map.of("quantity", 1)))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
