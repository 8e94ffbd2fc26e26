package org.nowstart.finpack.strategy.buy;

import java.util.List;
import java.util.Map;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Keeps tickers whose Sharpe value for the day is at least {@code threshold}. No value means no pass.
 */
@Component
public class SharpeThresholdCondition implements BuyCondition<SharpeThresholdCondition.Params> {

    public static final String ID = "sharpe_threshold";

    public record Params(double threshold) implements RuleParams {
        public Params {
            if (!Double.isFinite(threshold)) {
                throw new IllegalArgumentException("threshold must be finite");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConditionCategory category() {
        return ConditionCategory.A;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(1.0);
    }

    @Override
    public List<String> filter(List<String> tickers, EvaluationContext context, Params params) {
        Map<String, Double> values = context.data().values(RankingMetric.SHARPE, context.date());
        return tickers.stream()
                .filter(ticker -> {
                    Double value = values.get(ticker);
                    return value != null && value >= params.threshold();
                })
                .toList();
    }
}
