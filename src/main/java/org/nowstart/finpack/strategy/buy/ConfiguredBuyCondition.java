package org.nowstart.finpack.strategy.buy;

import java.util.List;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleDescription;
import org.nowstart.finpack.strategy.core.RuleParams;

public record ConfiguredBuyCondition<P extends RuleParams>(
        BuyCondition<P> condition,
        P params
) {
    public String id() {
        return condition.id();
    }

    public ConditionCategory category() {
        return condition.category();
    }

    public List<String> filter(List<String> tickers, EvaluationContext context) {
        return condition.filter(tickers, context, params);
    }

    public RuleDescription describe() {
        return new RuleDescription("buy", condition.id(), condition.category().name(), params);
    }
}
