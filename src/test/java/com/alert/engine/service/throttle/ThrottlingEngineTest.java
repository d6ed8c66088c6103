package com.alert.engine.service.throttle;

import com.alert.engine.service.alert.Alert;
import com.alert.engine.service.alert.AlertProcessingException;
import com.alert.engine.service.definition.AlertDefinition;
import com.alert.engine.service.definition.ThrottlingStrategyType;
import com.alert.engine.service.processor.ProcessOptions;
import com.alert.engine.service.support.EngineFixture;
import com.alert.engine.service.support.TestDefinitions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ThrottlingEngineTest {

    private final EngineFixture fixture = new EngineFixture();
    private final AlertDefinition definition = TestDefinitions.outOfStock("oos").build();
    private final Map<String, Object> event = Map.of("productId", "p1", "storeId", "s1", "quantity", 0);

    @Test
    void duplicate_winsOverStrategyAndLeavesStateUntouched() {
        Alert existing = fixture.lifecycleManager.admit(candidate());
        ThrottlingState state = fixture.stateStore.getOrCreate("oos", EngineFixture.START);

        ThrottlingDecision decision = fixture.throttlingEngine.decide(candidate(), definition, state, fixture.clock.instant());

        assertThat(decision).isEqualTo(ThrottlingDecision.deduplicate(existing.getId()));
        assertThat(state.getCountInWindow()).isZero();
    }

    @Test
    void resolvedAlert_isNoLongerADuplicateTarget() {
        fixture.register(definition);
        Alert existing = fixture.lifecycleManager.admit(candidate());
        fixture.lifecycleManager.resolve(existing.getId(), "fixed", "ops");
        ThrottlingState state = fixture.stateStore.getOrCreate("oos", EngineFixture.START);

        assertThat(fixture.throttlingEngine.decide(candidate(), definition, state, fixture.clock.instant()).outcome())
                .isEqualTo(ThrottlingDecision.Outcome.ADMIT);
    }

    @Test
    void duplicateOutsideWindow_isAdmitted() {
        fixture.lifecycleManager.admit(candidate());
        fixture.clock.advance(Duration.ofHours(3));
        ThrottlingState state = fixture.stateStore.getOrCreate("oos", fixture.clock.instant());

        assertThat(fixture.throttlingEngine.decide(candidate(), definition, state, fixture.clock.instant()).outcome())
                .isEqualTo(ThrottlingDecision.Outcome.ADMIT);
    }

    @Test
    void decide_touchesStateActivity() {
        ThrottlingState state = fixture.stateStore.getOrCreate("oos", EngineFixture.START);
        fixture.clock.advance(Duration.ofMinutes(7));

        fixture.throttlingEngine.decide(candidate(), definition, state, fixture.clock.instant());

        assertThat(state.getLastActivity()).isEqualTo(fixture.clock.instant());
    }

    @Test
    void missingStrategy_raisesThrottlingFailure() {
        ThrottlingEngine engine = new ThrottlingEngine(fixture.deduplicationIndex, List.of(new TimeBasedStrategy()));
        AlertDefinition cooldown = definition.toBuilder().throttlingStrategy(ThrottlingStrategyType.COUNT_BASED).build();
        ThrottlingState state = new ThrottlingState("oos", EngineFixture.START);

        assertThatThrownBy(() -> engine.decide(candidate(), cooldown, state, EngineFixture.START))
                .isInstanceOf(AlertProcessingException.class)
                .extracting("errorCode")
                .isEqualTo(AlertProcessingException.THROTTLING_FAILED);
    }

    private Alert candidate() {
        return fixture.alertFactory.create(definition, event, ProcessOptions.defaults());
    }
}
