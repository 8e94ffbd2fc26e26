package org.nowstart.finpack.strategy.buy;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

@Component
public class GrowthRankCondition implements BuyCondition<GrowthRankCondition.Params> {

    public static final String ID = "growth_rank";

    public record Params(int topN) implements RuleParams {
        public Params {
            if (topN <= 0) {
                throw new IllegalArgumentException("topN must be > 0");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConditionCategory category() {
        return ConditionCategory.B;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(7);
    }

    @Override
    public List<String> filter(List<String> tickers, EvaluationContext context, Params params) {
        Set<String> top = new HashSet<>(context.data().topRanked(RankingMetric.GROWTH, context.date(), params.topN()));
        return tickers.stream().filter(top::contains).toList();
    }
}
