package org.nowstart.finpack.strategy.rebalance;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Rebalances only when the leaders clearly lead: the average Sharpe of the top
 * {@code concentrateTopK} beats the next K by at least {@code leadMargin} (relative), or the next K
 * average is non-positive while the top K average is positive.
 */
@Component
public class ConcentratedRebalance implements RebalanceStrategy<ConcentratedRebalance.Params> {

    public static final String ID = "concentrated";

    public record Params(int concentrateTopK, double leadMargin) implements RuleParams {
        public Params {
            if (concentrateTopK <= 0) {
                throw new IllegalArgumentException("concentrateTopK must be > 0");
            }
            if (!Double.isFinite(leadMargin) || leadMargin < 0.0) {
                throw new IllegalArgumentException("leadMargin must be >= 0");
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
        return new Params(3, 0.30);
    }

    @Override
    public boolean shouldRebalance(RebalanceContext context, Params params) {
        if (!context.hasNewTarget()) {
            return false;
        }

        EvaluationContext evaluation = context.evaluation();
        int k = params.concentrateTopK();
        List<String> topK = new ArrayList<>();
        List<String> nextK = new ArrayList<>();
        for (Country country : evaluation.data().scope().countries()) {
            List<String> ranked = evaluation.data().ranking(RankingMetric.SHARPE, evaluation.date(), country);
            topK.addAll(ranked.subList(0, Math.min(k, ranked.size())));
            nextK.addAll(ranked.subList(Math.min(k, ranked.size()), Math.min(2 * k, ranked.size())));
        }

        double topAverage = SharpeAverages.average(topK, evaluation);
        double nextAverage = SharpeAverages.average(nextK, evaluation);
        if (nextAverage <= 0.0) {
            return topAverage > 0.0;
        }
        return (topAverage - nextAverage) / Math.abs(nextAverage) >= params.leadMargin();
    }
}
