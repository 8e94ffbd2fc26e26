package org.nowstart.finpack.strategy.sell;

import java.time.LocalDate;
import java.util.List;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.nowstart.finpack.strategy.core.SellCondition;
import org.springframework.stereotype.Component;

/**
 * Sells after {@code periods} consecutive ranking dates outside the Sharpe top {@code topN} of the
 * ticker's own country. A day without a ranking table leaves the streak as it was.
 */
@Component
public class SharpeFailCondition implements SellCondition<SharpeFailCondition.Params> {

    public static final String ID = "sharpe_fail";

    public record Params(int periods, int topN) implements RuleParams {
        public Params {
            if (periods <= 0) {
                throw new IllegalArgumentException("periods must be > 0");
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
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(2, 15);
    }

    @Override
    public SellDecision check(Position position, EvaluationContext context, Params params) {
        LocalDate date = context.date();
        if (!context.data().hasRanking(RankingMetric.SHARPE, date)) {
            return decide(position.getConsecutiveRankFailures(), params);
        }
        List<String> ranking = context.data().ranking(RankingMetric.SHARPE, date, position.getCountry());
        boolean inTop = ranking.subList(0, Math.min(params.topN(), ranking.size())).contains(position.getTicker());
        return decide(position.recordRankCheck(!inTop), params);
    }

    private SellDecision decide(int streak, Params params) {
        if (streak >= params.periods()) {
            return SellDecision.sell("sharpe outside top " + params.topN() + " for " + params.periods() + " periods");
        }
        return SellDecision.hold();
    }
}
