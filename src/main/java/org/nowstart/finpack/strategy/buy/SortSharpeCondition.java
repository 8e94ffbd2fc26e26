package org.nowstart.finpack.strategy.buy;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Picks the {@code selectN} candidates with the highest Sharpe value, best first.
 */
@Component
public class SortSharpeCondition implements BuyCondition<SortSharpeCondition.Params> {

    public static final String ID = "sort_sharpe";

    public record Params(int selectN) implements RuleParams {
        public Params {
            if (selectN <= 0) {
                throw new IllegalArgumentException("selectN must be > 0");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConditionCategory category() {
        return ConditionCategory.C;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(5);
    }

    @Override
    public List<String> filter(List<String> tickers, EvaluationContext context, Params params) {
        Map<String, Double> values = context.data().values(RankingMetric.SHARPE, context.date());
        return tickers.stream()
                .filter(ticker -> values.get(ticker) != null)
                .sorted(Comparator.comparingDouble((String ticker) -> values.get(ticker)).reversed())
                .limit(params.selectN())
                .toList();
    }
}
