package org.nowstart.finpack.strategy.rebalance;

import java.util.List;
import java.util.Map;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.EvaluationContext;

final class SharpeAverages {

    private SharpeAverages() {
    }

    /**
     * Mean Sharpe value of {@code tickers} on the context date; a missing value counts as 0, an empty list averages 0.
     */
    static double average(List<String> tickers, EvaluationContext context) {
        if (tickers.isEmpty()) {
            return 0.0;
        }
        Map<String, Double> values = context.data().values(RankingMetric.SHARPE, context.date());
        double sum = 0.0;
        for (String ticker : tickers) {
            Double value = values.get(ticker);
            sum += value == null ? 0.0 : value;
        }
        return sum / tickers.size();
    }
}
