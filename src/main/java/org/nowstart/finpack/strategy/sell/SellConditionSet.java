package org.nowstart.finpack.strategy.sell;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;

/**
 * Enabled sell conditions. Every condition is checked, even after one already fired, so streak
 * counters advance on every day; the position is sold if any of them fired.
 */
public final class SellConditionSet {

    private final List<ConfiguredSellCondition<?>> conditions;

    public SellConditionSet(List<ConfiguredSellCondition<?>> conditions) {
        this.conditions = List.copyOf(conditions);
    }

    public List<ConfiguredSellCondition<?>> conditions() {
        return conditions;
    }

    public boolean isEmpty() {
        return conditions.isEmpty();
    }

    public SellDecision evaluate(Position position, EvaluationContext context) {
        List<SellDecision> decisions = new ArrayList<>(conditions.size());
        for (ConfiguredSellCondition<?> condition : conditions) {
            decisions.add(condition.check(position, context));
        }
        return SellDecision.combine(decisions);
    }
}
