package org.nowstart.finpack.strategy.buy;

import java.time.LocalDate;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Keeps tickers that stayed in the Sharpe top {@code topN} on each of the last {@code days}
 * ranking dates up to today. Less history than {@code days} yields nothing.
 */
@Component
public class SharpeStreakCondition implements BuyCondition<SharpeStreakCondition.Params> {

    public static final String ID = "sharpe_streak";

    public record Params(int days, int topN) implements RuleParams {
        public Params {
            if (days <= 0) {
                throw new IllegalArgumentException("days must be > 0");
            }
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
        return ConditionCategory.A;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(3, 10);
    }

    @Override
    public List<String> filter(List<String> tickers, EvaluationContext context, Params params) {
        List<LocalDate> dates = context.data().rankingDatesUpTo(RankingMetric.SHARPE, context.date());
        if (dates.size() < params.days()) {
            return List.of();
        }

        Set<String> consistent = new LinkedHashSet<>(tickers);
        for (LocalDate date : dates.subList(dates.size() - params.days(), dates.size())) {
            consistent.retainAll(context.data().topRanked(RankingMetric.SHARPE, date, params.topN()));
        }
        return List.copyOf(consistent);
    }
}
