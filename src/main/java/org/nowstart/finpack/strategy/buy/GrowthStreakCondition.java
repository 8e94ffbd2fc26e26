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
 * Keeps tickers ranked in the top {@code percentile}% of growth on each of the last {@code days}
 * ranking dates. Less history than {@code days} yields nothing.
 */
@Component
public class GrowthStreakCondition implements BuyCondition<GrowthStreakCondition.Params> {

    public static final String ID = "growth_streak";

    public record Params(int days, double percentile) implements RuleParams {
        public Params {
            if (days <= 0) {
                throw new IllegalArgumentException("days must be > 0");
            }
            if (!(percentile > 0.0) || percentile > 100.0) {
                throw new IllegalArgumentException("percentile must be in (0, 100]");
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
        return new Params(2, 30.0);
    }

    @Override
    public List<String> filter(List<String> tickers, EvaluationContext context, Params params) {
        List<LocalDate> dates = context.data().rankingDatesUpTo(RankingMetric.GROWTH, context.date());
        if (dates.size() < params.days()) {
            return List.of();
        }

        Set<String> consistent = new LinkedHashSet<>(tickers);
        for (LocalDate date : dates.subList(dates.size() - params.days(), dates.size())) {
            consistent.retainAll(context.data().topPercentile(RankingMetric.GROWTH, date, params.percentile()));
        }
        return List.copyOf(consistent);
    }
}
