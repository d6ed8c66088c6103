package com.alert.engine.service.enrich;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AuditEntry;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.AlertPriority;
import com.alert.engine.service.definition.AlertType;
import com.alert.engine.service.definition.TriggerCondition;
import com.alert.engine.service.processor.ProcessOptions;
import com.alert.engine.service.support.EngineFixture;
import com.alert.engine.service.support.TestDefinitions;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertFactoryTest {

    private final EngineFixture fixture = new EngineFixture();
    private final AlertFactory factory = fixture.alertFactory;

    @Test
    void create_outOfStock_enrichesFromEventData() {
        AlertDefinition definition = TestDefinitions.outOfStock("oos").build();
        Map<String, Object> data = Map.of("productId", "p1", "productName", "Widget", "storeId", "s9",
                "quantity", 0, "price", 25.0, "averageDailySales", 4);

        Alert alert = factory.create(definition, data, ProcessOptions.builder().sourceSystem("inventory").build());

        assertThat(alert.getId()).isNotBlank();
        assertThat(alert.getTitle()).isEqualTo("OUT OF STOCK: Widget");
        assertThat(alert.getMessage()).startsWith("Product is out of stock\n\nDetails: ");
        assertThat(alert.getStoreId()).isEqualTo("s9");
        assertThat(alert.getSourceSystem()).isEqualTo("inventory");
        assertThat(alert.getPriority()).isEqualTo(AlertPriority.CRITICAL);
        assertThat(alert.getEstimatedRevenueLoss()).isEqualTo(100.0);
        assertThat(alert.getDetails()).containsEntry("stockSeverity", "CRITICAL");
        assertThat(alert.getTriggeredAt()).isEqualTo(EngineFixture.START);
        assertThat(alert.isSecurityRelevant()).isFalse();
        assertThat(alert.getAuditTrail()).extracting(AuditEntry::action).containsExactly(AuditEntry.ALERT_TRIGGERED);
    }

    @Test
    void create_lowStock_usesDefaultPricing() {
        Alert alert = factory.create(TestDefinitions.lowStock("low").build(),
                Map.of("productId", "p1", "quantity", 8), ProcessOptions.defaults());

        assertThat(alert.getTitle()).isEqualTo("Low Stock Alert: p1 (8 remaining)");
        assertThat(alert.getEstimatedRevenueLoss()).isEqualTo(200.0);
        assertThat(alert.getDetails()).containsEntry("stockSeverity", "HIGH");
    }

    @Test
    void create_securityIncident_derivesThreatLevel() {
        AlertDefinition definition = AlertDefinition.builder()
                .id("security")
                .eventType(AlertType.SECURITY_INCIDENT)
                .name("Security Incident")
                .triggerCondition(TriggerCondition.of("riskScore", ">=", 80))
                .priority(AlertPriority.EMERGENCY)
                .severity(10)
                .build();

        Alert alert = factory.create(definition,
                Map.of("incidentType", "brute_force", "riskScore", 92, "affectedUsers", 150),
                ProcessOptions.defaults());

        assertThat(alert.getTitle()).isEqualTo("Security Incident: brute_force (Risk Score: 92)");
        assertThat(alert.isSecurityRelevant()).isTrue();
        assertThat(alert.getThreatLevel()).isEqualTo(AlertFactory.THREAT_CRITICAL);
        assertThat(alert.getAffectedUsers()).isEqualTo(150);
        assertThat(fixture.riskScoreCalculator.score(alert)).isEqualTo(100);
    }

    @Test
    void threatLevel_bands() {
        assertThat(factory.threatLevel(AlertType.SECURITY_INCIDENT, Map.of("riskScore", 75))).isEqualTo(AlertFactory.THREAT_HIGH);
        assertThat(factory.threatLevel(AlertType.SECURITY_INCIDENT, Map.of("riskScore", 55))).isEqualTo(AlertFactory.THREAT_MEDIUM);
        assertThat(factory.threatLevel(AlertType.SECURITY_INCIDENT, Map.of())).isEqualTo(AlertFactory.THREAT_LOW);
        assertThat(factory.threatLevel(AlertType.SYSTEM_ERROR, Map.of("riskScore", 99))).isEqualTo(AlertFactory.THREAT_LOW);
    }

    @Test
    void systemError_hasFixedDowntimeCost() {
        assertThat(factory.revenueLoss(AlertType.SYSTEM_ERROR, Map.of())).isEqualTo(AlertFactory.SYSTEM_DOWNTIME_COST);
        assertThat(factory.revenueLoss(AlertType.PRICE_CHANGE, Map.of("price", 10))).isZero();
    }
}
