package org.nowstart.finpack.strategy.sell;

import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.SellCondition;
import org.springframework.stereotype.Component;

/**
 * Sells when the growth value averaged over the last {@code days} value dates falls below
 * {@code threshold}. Dates where the ticker has no value are skipped.
 */
@Component
public class GrowthFailCondition implements SellCondition<GrowthFailCondition.Params> {

    public static final String ID = "growth_fail";

    public record Params(int days, double threshold) implements RuleParams {
        public Params {
            if (days <= 0) {
                throw new IllegalArgumentException("days must be > 0");
            }
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
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(5, 0.0);
    }

    @Override
    public SellDecision check(Position position, EvaluationContext context, Params params) {
        List<LocalDate> dates = context.data().valueDatesUpTo(RankingMetric.GROWTH, context.date());
        if (dates.size() < params.days()) {
            return SellDecision.hold();
        }

        double sum = 0.0;
        int count = 0;
        for (LocalDate date : dates.subList(dates.size() - params.days(), dates.size())) {
            Double value = context.data().value(RankingMetric.GROWTH, date, position.getTicker());
            if (value != null && Double.isFinite(value)) {
                sum += value;
                count++;
            }
        }
        if (count == 0) {
            return SellDecision.hold();
        }

        double average = sum / count;
        if (average < params.threshold()) {
            return SellDecision.sell(String.format(Locale.US, "growth average %.3f below %s over %d periods",
                    average, params.threshold(), params.days()));
        }
        return SellDecision.hold();
    }
}
