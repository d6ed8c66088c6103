package com.alert.engine.service.definition;

/**
 * Single {@code field operator value} predicate over event data.
 */
public record TriggerCondition(String field, ConditionOperator operator, Object value) {

    public static TriggerCondition of(String field, String operator, Object value) {
        return new TriggerCondition(field, ConditionOperator.fromSymbol(operator), value);
    }

    @Override
    public String toString() {
        return field + " " + operator.getSymbol() + " " + value;
    }
}
