package org.nowstart.finpack.strategy.core;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Everything a rule may read for one simulated day. {@code prices} are already resolved to the
 * last known close and {@code exchangeRate} is the USD/TWD rate for the day.
 */
public record EvaluationContext(
        LocalDate date,
        MarketDataView data,
        Map<String, Double> prices,
        double exchangeRate,
        SelectionHistory selectionHistory,
        List<String> holdings
) {
    public Double price(String ticker) {
        return prices.get(ticker);
    }
}
