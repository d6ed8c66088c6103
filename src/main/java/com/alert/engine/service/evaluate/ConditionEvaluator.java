package com.alert.engine.service.evaluate;

import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ConditionOperator;
import com.alert.engine.service.definition.TriggerCondition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates trigger and auto-resolve conditions against event data.
 *
 * Conditions are combined with AND. A missing field never matches. Evaluation has no side
 * effects and never throws.
 */
@Slf4j
@Component
public class ConditionEvaluator {

    public boolean matches(AlertDefinition definition, Map<String, Object> eventData) {
        return matchesAll(definition.getTriggerConditions(), eventData);
    }

    public boolean matchesAll(List<TriggerCondition> conditions, Map<String, Object> data) {
        if (conditions == null || conditions.isEmpty()) {
            return true;
        }
        if (data == null) {
            return false;
        }
        for (TriggerCondition condition : conditions) {
            if (!matches(condition, data)) {
                log.debug("Condition not met: {}", condition);
                return false;
            }
        }
        return true;
    }

    public boolean matches(TriggerCondition condition, Map<String, Object> data) {
        Object actual = data.get(condition.field());
        Object expected = condition.value();
        if (actual == null || expected == null) {
            return false;
        }
        ConditionOperator operator = condition.operator();
        return switch (operator) {
            case EQUALS -> isEqual(actual, expected);
            case NOT_EQUALS -> !isEqual(actual, expected);
            case GREATER_THAN, LESS_THAN, GREATER_OR_EQUAL, LESS_OR_EQUAL -> compare(actual, expected)
                    .map(result -> ordering(operator, result))
                    .orElse(false);
            case CONTAINS -> String.valueOf(actual).contains(String.valueOf(expected));
            case REGEX -> regexFind(String.valueOf(expected), String.valueOf(actual));
        };
    }

    // --- Private helpers ---

    private boolean ordering(ConditionOperator operator, int result) {
        return switch (operator) {
            case GREATER_THAN -> result > 0;
            case LESS_THAN -> result < 0;
            case GREATER_OR_EQUAL -> result >= 0;
            case LESS_OR_EQUAL -> result <= 0;
            default -> false;
        };
    }

    private boolean isEqual(Object actual, Object expected) {
        if (actual instanceof Number) {
            Optional<BigDecimal> left = toDecimal(actual);
            Optional<BigDecimal> right = toDecimal(expected);
            if (left.isPresent() && right.isPresent()) {
                return left.get().compareTo(right.get()) == 0;
            }
            return false;
        }
        if (actual instanceof Boolean && expected instanceof String text) {
            return actual.toString().equalsIgnoreCase(text.trim());
        }
        return Objects.equals(actual, expected);
    }

    /**
     * Compares numbers numerically and strings lexicographically; empty for anything else.
     */
    private Optional<Integer> compare(Object actual, Object expected) {
        if (actual instanceof Number) {
            Optional<BigDecimal> left = toDecimal(actual);
            Optional<BigDecimal> right = toDecimal(expected);
            if (left.isPresent() && right.isPresent()) {
                return Optional.of(left.get().compareTo(right.get()));
            }
            return Optional.empty();
        }
        if (actual instanceof String left && expected instanceof String right) {
            return Optional.of(left.compareTo(right));
        }
        return Optional.empty();
    }

    private Optional<BigDecimal> toDecimal(Object value) {
        try {
            if (value instanceof BigDecimal decimal) {
                return Optional.of(decimal);
            }
            if (value instanceof Double || value instanceof Float) {
                double d = ((Number) value).doubleValue();
                return Double.isFinite(d) ? Optional.of(BigDecimal.valueOf(d)) : Optional.empty();
            }
            if (value instanceof Number number) {
                return Optional.of(new BigDecimal(number.toString()));
            }
            if (value instanceof String text) {
                return Optional.of(new BigDecimal(text.trim()));
            }
        } catch (NumberFormatException e) {
            log.debug("Value is not numeric: {}", value);
        }
        return Optional.empty();
    }

    private boolean regexFind(String pattern, String input) {
        try {
            return Pattern.compile(pattern).matcher(input).find();
        } catch (PatternSyntaxException e) {
            log.debug("Malformed condition pattern '{}': {}", pattern, e.getDescription());
            return false;
        }
    }
}
