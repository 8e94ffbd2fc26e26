package org.nowstart.finpack.strategy.rebalance;

import org.nowstart.finpack.strategy.core.NoParams;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.springframework.stereotype.Component;

/**
 * Moves to the target list whenever it differs from the current holdings.
 */
@Component
public class ImmediateRebalance implements RebalanceStrategy<NoParams> {

    public static final String ID = "immediate";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<NoParams> parameterType() {
        return NoParams.class;
    }

    @Override
    public NoParams defaultParams() {
        return NoParams.INSTANCE;
    }

    @Override
    public boolean shouldRebalance(RebalanceContext context, NoParams params) {
        return context.targetsDifferFromHoldings();
    }
}
