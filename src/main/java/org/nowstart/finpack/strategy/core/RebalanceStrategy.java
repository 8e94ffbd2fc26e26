package org.nowstart.finpack.strategy.core;

import java.util.List;
import org.nowstart.finpack.data.dto.RebalanceResult;
import org.nowstart.finpack.ledger.TradeExecutor;

public interface RebalanceStrategy<P extends RuleParams> extends Rule<P> {

    boolean shouldRebalance(RebalanceContext context, P params);

    /**
     * Whether free slots may be topped up at {@code amountPerStock} on authorized days.
     * Strategies that budget their own buys return false.
     */
    default boolean fillsOpenSlots() {
        return true;
    }

    default RebalanceResult execute(TradeExecutor executor, List<String> targets, EvaluationContext context, P params) {
        return executor.executeRebalance(
                targets,
                context.prices(),
                context.data().stockInfo(),
                context.date(),
                context.exchangeRate()
        );
    }
}
