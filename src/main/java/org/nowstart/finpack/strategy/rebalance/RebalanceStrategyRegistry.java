package org.nowstart.finpack.strategy.rebalance;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.util.List;
import java.util.Map;
import org.nowstart.finpack.data.dto.RuleConfig;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.RuleRegistry;
import org.springframework.stereotype.Component;

@Component
public class RebalanceStrategyRegistry extends RuleRegistry<RebalanceStrategy<? extends RuleParams>> {

    public RebalanceStrategyRegistry(List<RebalanceStrategy<? extends RuleParams>> strategies, ObjectMapper objectMapper) {
        super("rebalance strategy", strategies, objectMapper);
    }

    /**
     * A disabled entry behaves as {@code none}.
     */
    public ConfiguredRebalanceStrategy<?> resolve(RuleConfig config) {
        RuleConfig resolved = config == null ? RuleConfig.enabled(ImmediateRebalance.ID) : config;
        RebalanceStrategy<? extends RuleParams> strategy = getRequired(resolved.id());
        if (!resolved.enabled()) {
            return configure(getRequired(NoneRebalance.ID), Map.of());
        }
        return configure(strategy, resolved.params());
    }

    private <P extends RuleParams> ConfiguredRebalanceStrategy<P> configure(RebalanceStrategy<P> strategy, Map<String, Object> params) {
        return new ConfiguredRebalanceStrategy<>(strategy, bindParams(strategy, params));
    }
}
