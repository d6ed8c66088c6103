package com.alert.engine.service.evaluate;

import com.alert.engine.service.definition.TriggerCondition;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;

class ConditionEvaluatorTest {

    private final ConditionEvaluator evaluator = new ConditionEvaluator();

    @Test
    void orderingOperators_compareNumbersAcrossTypes() {
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "<=", 10), Map.of("quantity", 5))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "<=", "10"), Map.of("quantity", 10L))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "<=", 10), Map.of("quantity", 10.5))).isFalse();
        assertThat(evaluator.matches(TriggerCondition.of("riskScore", "≥", 80), Map.of("riskScore", 80))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("riskScore", ">", 80), Map.of("riskScore", 80))).isFalse();
        assertThat(evaluator.matches(TriggerCondition.of("riskScore", "<", 80), Map.of("riskScore", 79.9))).isTrue();
    }

    @Test
    void equality_isNumericForNumbers() {
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "=", 0), Map.of("quantity", 0))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "=", 0), Map.of("quantity", 0.0))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "!=", 0), Map.of("quantity", 3))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "≠", 3), Map.of("quantity", 3L))).isFalse();
    }

    @Test
    void equality_acceptsBooleanConfiguredAsText() {
        assertThat(evaluator.matches(TriggerCondition.of("systemHealthy", "=", "true"), Map.of("systemHealthy", true))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("systemHealthy", "=", true), Map.of("systemHealthy", true))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("systemHealthy", "=", true), Map.of("systemHealthy", false))).isFalse();
    }

    @Test
    void strings_compareLexicographically() {
        assertThat(evaluator.matches(TriggerCondition.of("errorLevel", ">=", "ERROR"), Map.of("errorLevel", "ERROR"))).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("errorLevel", ">=", "ERROR"), Map.of("errorLevel", "DEBUG"))).isFalse();
    }

    @Test
    void mixedTypes_doNotMatch() {
        assertThat(evaluator.matches(TriggerCondition.of("quantity", ">", 5), Map.of("quantity", "many"))).isFalse();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", ">", "lots"), Map.of("quantity", 7))).isFalse();
    }

    @Test
    void missingOrNullField_failsClosed() {
        Map<String, Object> data = new HashMap<>();
        data.put("quantity", null);

        assertThat(evaluator.matches(TriggerCondition.of("quantity", "<=", 10), data)).isFalse();
        assertThat(evaluator.matches(TriggerCondition.of("quantity", "!=", 10), Map.of())).isFalse();
    }

    @Test
    void containsAndRegex() {
        Map<String, Object> data = Map.of("message", "disk full on node-3", "errorCode", "ERR-500");

        assertThat(evaluator.matches(TriggerCondition.of("message", "contains", "disk"), data)).isTrue();
        assertThat(evaluator.matches(TriggerCondition.of("message", "contains", "memory"), data)).isFalse();
        assertThat(evaluator.matches(TriggerCondition.of("errorCode", "regex", "^ERR-\\d+$"), data)).isTrue();
    }

    @Test
    @DisplayName("A malformed pattern is no match, never an exception")
    void malformedRegex_isNoMatch() {
        TriggerCondition condition = TriggerCondition.of("errorCode", "regex", "[unclosed");

        assertThatCode(() -> evaluator.matches(condition, Map.of("errorCode", "ERR-1"))).doesNotThrowAnyException();
        assertThat(evaluator.matches(condition, Map.of("errorCode", "ERR-1"))).isFalse();
    }

    @Test
    void conditions_areCombinedWithAnd() {
        List<TriggerCondition> conditions = List.of(
                TriggerCondition.of("quantity", "<=", 10),
                TriggerCondition.of("storeId", "=", "s1"));

        assertThat(evaluator.matchesAll(conditions, Map.of("quantity", 4, "storeId", "s1"))).isTrue();
        assertThat(evaluator.matchesAll(conditions, Map.of("quantity", 4, "storeId", "s2"))).isFalse();
        assertThat(evaluator.matchesAll(List.of(), Map.of())).isTrue();
    }
}
