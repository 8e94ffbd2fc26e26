package org.nowstart.finpack.strategy.sell;

import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleDescription;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.SellCondition;

public record ConfiguredSellCondition<P extends RuleParams>(
        SellCondition<P> condition,
        P params
) {
    public String id() {
        return condition.id();
    }

    public SellDecision check(Position position, EvaluationContext context) {
        return condition.check(position, context, params);
    }

    public RuleDescription describe() {
        return new RuleDescription("sell", condition.id(), null, params);
    }
}
