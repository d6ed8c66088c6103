package com.alert.engine.service.definition;

import java.util.List;

/**
 * Read-only source of alert definitions, consulted at startup and on refresh.
 */
public interface AlertDefinitionSource {

    /**
     * Loads all definitions, in registration order.
     *
     * @return the definitions; invalid entries are filtered later by the registry
     */
    List<AlertDefinition> loadDefinitions();
}
