package org.nowstart.finpack.strategy.sell;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.finpack.data.dto.RuleConfig;
import org.nowstart.finpack.data.exception.BacktestException;

class SellConditionRegistryTest {

    private final SellConditionRegistry registry = registry();

    @Test
    void resolve_skipsDisabledConditions() {
        SellConditionSet set = registry.resolve(List.of(
                RuleConfig.enabled(DrawdownCondition.ID, Map.of("threshold", 0.2, "fromHighest", true)),
                new RuleConfig(WeaknessCondition.ID, false, Map.of())
        ));

        assertThat(set.conditions()).hasSize(1);
        assertThat(set.conditions().get(0).describe().params()).isEqualTo(new DrawdownCondition.Params(0.2, true));
    }

    @Test
    void resolve_emptyListYieldsEmptySet() {
        assertThat(registry.resolve(List.of()).isEmpty()).isTrue();
    }

    @Test
    void resolve_rejectsSameConditionTwice() {
        assertThatThrownBy(() -> registry.resolve(List.of(
                RuleConfig.enabled(SharpeFailCondition.ID),
                RuleConfig.enabled("Sharpe_Fail")
        )))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(BacktestException.INVALID_REQUEST);
    }

    @Test
    void resolve_rejectsThresholdAboveOne() {
        assertThatThrownBy(() -> registry.resolve(List.of(RuleConfig.enabled(DrawdownCondition.ID, Map.of("threshold", 40)))))
                .isInstanceOf(BacktestException.class)
                .extracting("code")
                .isEqualTo(BacktestException.INVALID_RULE_PARAMS);
    }

    private static SellConditionRegistry registry() {
        SellConditionRegistry registry = new SellConditionRegistry(List.of(
                new SharpeFailCondition(),
                new WeaknessCondition(),
                new GrowthFailCondition(),
                new NotSelectedCondition(),
                new DrawdownCondition()
        ), new ObjectMapper());
        registry.init();
        return registry;
    }
}
