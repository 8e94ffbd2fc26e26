package org.nowstart.finpack.strategy.sell;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.nowstart.finpack.data.dto.RuleConfig;
import org.nowstart.finpack.data.exception.BacktestException;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.RuleRegistry;
import org.nowstart.finpack.strategy.core.SellCondition;
import org.springframework.stereotype.Component;

@Component
public class SellConditionRegistry extends RuleRegistry<SellCondition<? extends RuleParams>> {

    public SellConditionRegistry(List<SellCondition<? extends RuleParams>> conditions, ObjectMapper objectMapper) {
        super("sell condition", conditions, objectMapper);
    }

    /**
     * A condition may be enabled once; its streak counter lives on the position and would be
     * advanced twice a day otherwise.
     */
    public SellConditionSet resolve(List<RuleConfig> configs) {
        List<ConfiguredSellCondition<?>> enabled = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RuleConfig config : configs) {
            SellCondition<? extends RuleParams> condition = getRequired(config.id());
            if (!config.enabled()) {
                continue;
            }
            if (!seen.add(condition.id())) {
                throw new BacktestException(BacktestException.INVALID_REQUEST, "Duplicate sell condition: " + condition.id());
            }
            enabled.add(configure(condition, config.params()));
        }
        return new SellConditionSet(enabled);
    }

    private <P extends RuleParams> ConfiguredSellCondition<P> configure(SellCondition<P> condition, Map<String, Object> params) {
        return new ConfiguredSellCondition<>(condition, bindParams(condition, params));
    }
}
