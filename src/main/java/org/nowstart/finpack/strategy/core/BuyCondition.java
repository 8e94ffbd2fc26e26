package org.nowstart.finpack.strategy.core;

import java.util.List;
import org.nowstart.finpack.data.type.ConditionCategory;

public interface BuyCondition<P extends RuleParams> extends Rule<P> {

    ConditionCategory category();

    /**
     * Returns the subset (A, B) or the ordered selection (C) of {@code tickers} for the context date.
     */
    List<String> filter(List<String> tickers, EvaluationContext context, P params);
}
