package org.nowstart.finpack.strategy.rebalance;

import java.util.List;
import org.nowstart.finpack.data.dto.RebalanceResult;
import org.nowstart.finpack.ledger.TradeExecutor;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.nowstart.finpack.strategy.core.RuleDescription;
import org.nowstart.finpack.strategy.core.RuleParams;

public record ConfiguredRebalanceStrategy<P extends RuleParams>(
        RebalanceStrategy<P> strategy,
        P params
) {
    public String id() {
        return strategy.id();
    }

    public boolean shouldRebalance(RebalanceContext context) {
        return strategy.shouldRebalance(context, params);
    }

    public boolean fillsOpenSlots() {
        return strategy.fillsOpenSlots();
    }

    public RebalanceResult execute(TradeExecutor executor, List<String> targets, EvaluationContext context) {
        return strategy.execute(executor, targets, context, params);
    }

    public RuleDescription describe() {
        return new RuleDescription("rebalance", strategy.id(), null, params);
    }
}
