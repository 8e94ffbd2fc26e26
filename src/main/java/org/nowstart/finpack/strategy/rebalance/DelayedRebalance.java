package org.nowstart.finpack.strategy.rebalance;

import java.util.List;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Waits for market strength: rebalances only when there is something new to buy and the average
 * Sharpe value of the top {@code topN} names of each country in scope exceeds {@code sharpeThreshold}.
 */
@Component
public class DelayedRebalance implements RebalanceStrategy<DelayedRebalance.Params> {

    public static final String ID = "delayed";

    public record Params(int topN, double sharpeThreshold) implements RuleParams {
        public Params {
            if (topN <= 0) {
                throw new IllegalArgumentException("topN must be > 0");
            }
            if (!Double.isFinite(sharpeThreshold)) {
                throw new IllegalArgumentException("sharpeThreshold must be finite");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(5, 0.0);
    }

    @Override
    public boolean shouldRebalance(RebalanceContext context, Params params) {
        if (!context.hasNewTarget()) {
            return false;
        }
        EvaluationContext evaluation = context.evaluation();
        List<String> top = evaluation.data().topRanked(RankingMetric.SHARPE, evaluation.date(), params.topN());
        return SharpeAverages.average(top, evaluation) > params.sharpeThreshold();
    }
}
