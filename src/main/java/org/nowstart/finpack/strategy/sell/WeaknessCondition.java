package org.nowstart.finpack.strategy.sell;

import java.time.LocalDate;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.MarketDataView;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.SellCondition;
import org.springframework.stereotype.Component;

/**
 * Relative weakness: the ticker ranks worse than {@code rankK} (or is unranked) on Sharpe and on
 * growth on the same day, for {@code periods} days in a row. Recovery on either metric resets the streak.
 */
@Component
public class WeaknessCondition implements SellCondition<WeaknessCondition.Params> {

    public static final String ID = "weakness";

    public record Params(int rankK, int periods) implements RuleParams {
        public Params {
            if (rankK <= 0) {
                throw new IllegalArgumentException("rankK must be > 0");
            }
            if (periods <= 0) {
                throw new IllegalArgumentException("periods must be > 0");
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
        return new Params(20, 3);
    }

    @Override
    public SellDecision check(Position position, EvaluationContext context, Params params) {
        MarketDataView data = context.data();
        LocalDate date = context.date();
        int streak = position.getConsecutiveWeakPeriods();
        if (data.hasRanking(RankingMetric.SHARPE, date) && data.hasRanking(RankingMetric.GROWTH, date)) {
            boolean sharpeWeak = ranksOutside(data, RankingMetric.SHARPE, date, position, params.rankK());
            boolean growthWeak = ranksOutside(data, RankingMetric.GROWTH, date, position, params.rankK());
            streak = position.recordWeaknessCheck(sharpeWeak && growthWeak);
        }
        if (streak >= params.periods()) {
            return SellDecision.sell("sharpe and growth rank beyond " + params.rankK() + " for " + params.periods() + " periods");
        }
        return SellDecision.hold();
    }

    private boolean ranksOutside(MarketDataView data, RankingMetric metric, LocalDate date, Position position, int rankK) {
        Country country = position.getCountry();
        int index = data.ranking(metric, date, country).indexOf(position.getTicker());
        return index < 0 || index >= rankK;
    }
}
