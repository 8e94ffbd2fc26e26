package org.nowstart.finpack.strategy.core;

import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.ledger.Position;

public interface SellCondition<P extends RuleParams> extends Rule<P> {

    /**
     * Called once per day for each open position. Streak conditions update the position's counters here.
     */
    SellDecision check(Position position, EvaluationContext context, P params);
}
