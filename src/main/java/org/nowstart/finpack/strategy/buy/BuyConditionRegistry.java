package org.nowstart.finpack.strategy.buy;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.nowstart.finpack.data.dto.RuleConfig;
import org.nowstart.finpack.data.exception.BacktestException;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.RuleRegistry;
import org.springframework.stereotype.Component;

@Component
public class BuyConditionRegistry extends RuleRegistry<BuyCondition<? extends RuleParams>> {

    public BuyConditionRegistry(List<BuyCondition<? extends RuleParams>> conditions, ObjectMapper objectMapper) {
        super("buy condition", conditions, objectMapper);
    }

    /**
     * Resolves every configured condition, including disabled ones so a typo is still reported,
     * and returns a pipeline of the enabled ones.
     */
    public BuyConditionPipeline resolve(List<RuleConfig> configs) {
        List<ConfiguredBuyCondition<?>> enabled = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        for (RuleConfig config : configs) {
            BuyCondition<? extends RuleParams> condition = getRequired(config.id());
            if (!config.enabled()) {
                continue;
            }
            if (!seen.add(condition.id())) {
                throw new BacktestException(BacktestException.INVALID_REQUEST, "Duplicate buy condition: " + condition.id());
            }
            enabled.add(configure(condition, config.params()));
        }
        return new BuyConditionPipeline(enabled);
    }

    private <P extends RuleParams> ConfiguredBuyCondition<P> configure(BuyCondition<P> condition, Map<String, Object> params) {
        return new ConfiguredBuyCondition<>(condition, bindParams(condition, params));
    }
}
