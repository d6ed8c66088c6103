package com.alert.engine.service.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Alert definitions bound from configuration.
 *
 * Entries are converted and validated by the properties definition source.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "alert.catalog")
public class AlertCatalogConfig {

    /**
     * Definitions in registration order.
     */
    private List<DefinitionProperties> definitions = new ArrayList<>();

    @Getter
    @Setter
    public static class DefinitionProperties {

        private String id;

        /**
         * Event type, e.g. {@code low_stock}.
         */
        private String eventType;

        private String name;

        private String description;

        private List<ConditionProperties> triggerConditions = new ArrayList<>();

        private String priority = "NORMAL";

        /**
         * Severity from 1 to 10.
         */
        private int severity = 5;

        private String businessImpact = "medium";

        private String throttlingStrategy = "TIME_BASED";

        private ThrottlingProperties throttling = new ThrottlingProperties();

        private DeduplicationProperties deduplication = new DeduplicationProperties();

        private List<String> notificationChannels = new ArrayList<>();

        private List<String> recipients = new ArrayList<>();

        private List<String> escalationRecipients = new ArrayList<>();

        private boolean suppressionEnabled = true;

        private ScheduleProperties schedule = new ScheduleProperties();

        private AutoResolveProperties autoResolve = new AutoResolveProperties();

        private boolean auditRequired = true;

        private boolean complianceRelevant = false;

        private int retentionPeriodDays = 90;

        private boolean enabled = true;

        private String createdBy = "system";
    }

    @Getter
    @Setter
    public static class ConditionProperties {

        private String field;

        /**
         * Operator symbol: {@code >}, {@code <}, {@code =}, {@code !=}, {@code >=}, {@code <=},
         * {@code contains} or {@code regex}.
         */
        private String operator;

        private Object value;
    }

    @Getter
    @Setter
    public static class ThrottlingProperties {

        private Duration timeWindow = Duration.ofHours(1);

        private int maxAlertsInWindow = 5;

        private Duration cooldownPeriod = Duration.ofMinutes(30);

        private double similarityThreshold = 0.8;

        private int escalationThreshold = 3;

        private boolean adaptiveLearning = false;
    }

    @Getter
    @Setter
    public static class DeduplicationProperties {

        private boolean enabled = false;

        private List<String> fields = new ArrayList<>();

        private Duration window = Duration.ofHours(1);
    }

    @Getter
    @Setter
    public static class ScheduleProperties {

        /**
         * Start of the active window, {@code HH:mm}.
         */
        private String start = "00:00";

        private String end = "23:59";

        /**
         * Active days, 0 = Sunday.
         */
        private List<Integer> days = new ArrayList<>(List.of(0, 1, 2, 3, 4, 5, 6));

        private String timezone = "UTC";
    }

    @Getter
    @Setter
    public static class AutoResolveProperties {

        private boolean enabled = false;

        private List<ConditionProperties> conditions = new ArrayList<>();

        private Duration timeout = Duration.ZERO;
    }
}
