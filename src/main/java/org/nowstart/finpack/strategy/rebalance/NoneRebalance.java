package org.nowstart.finpack.strategy.rebalance;

import org.nowstart.finpack.strategy.core.NoParams;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.springframework.stereotype.Component;

/**
 * Never deploys capital. Holdings still leave through the sell conditions.
 */
@Component
public class NoneRebalance implements RebalanceStrategy<NoParams> {

    public static final String ID = "none";

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
        return false;
    }
}
