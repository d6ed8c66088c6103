package com.alert.engine.service.definition;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Validated, ordered view of the loaded alert definitions.
 *
 * Invalid definitions and duplicate ids are skipped with a warning; neither is fatal.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class AlertDefinitionRegistry {

    private final AlertDefinitionSource source;

    private volatile Map<String, AlertDefinition> definitions = Collections.emptyMap();

    @PostConstruct
    void init() {
        refresh();
    }

    /**
     * Reloads definitions from the source, replacing the current set atomically.
     *
     * @return number of definitions registered
     */
    public int refresh() {
        Map<String, AlertDefinition> loaded = new LinkedHashMap<>();
        for (AlertDefinition definition : source.loadDefinitions()) {
            List<String> problems = definition.validate();
            if (!problems.isEmpty()) {
                log.warn("Skipping invalid alert definition {}: {}", definition.getId(), problems);
                continue;
            }
            if (loaded.containsKey(definition.getId())) {
                log.warn("Skipping duplicate alert definition id: {}", definition.getId());
                continue;
            }
            loaded.put(definition.getId(), definition);
        }
        this.definitions = Collections.unmodifiableMap(loaded);
        log.info("Alert definition registry initialized with {} definitions", loaded.size());
        return loaded.size();
    }

    /**
     * First enabled definition for the event type, in registration order.
     */
    public Optional<AlertDefinition> findFirstEnabled(AlertType eventType) {
        return definitions.values().stream()
                .filter(AlertDefinition::isEnabled)
                .filter(definition -> definition.getEventType() == eventType)
                .findFirst();
    }

    public Optional<AlertDefinition> findById(String definitionId) {
        return Optional.ofNullable(definitions.get(definitionId));
    }

    public Collection<AlertDefinition> all() {
        return definitions.values();
    }

    public int count() {
        return definitions.size();
    }
}
