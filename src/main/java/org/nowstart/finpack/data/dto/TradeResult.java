package org.nowstart.finpack.data.dto;

import org.nowstart.finpack.data.type.TradeRejection;

public record TradeResult(
        String ticker,
        boolean success,
        TradeRejection rejection,
        TradeRecord trade,
        double required,
        double available
) {
    public static TradeResult filled(TradeRecord trade) {
        return new TradeResult(trade.ticker(), true, null, trade, Double.NaN, Double.NaN);
    }

    public static TradeResult rejected(String ticker, TradeRejection rejection) {
        return new TradeResult(ticker, false, rejection, null, Double.NaN, Double.NaN);
    }

    public static TradeResult rejected(String ticker, TradeRejection rejection, double required, double available) {
        return new TradeResult(ticker, false, rejection, null, required, available);
    }

    public String reason() {
        return rejection == null ? null : rejection.code();
    }
}
