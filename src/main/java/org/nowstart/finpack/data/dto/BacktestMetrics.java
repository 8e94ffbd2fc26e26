package org.nowstart.finpack.data.dto;

/**
 * Performance summary. Rates are fractions (0.12 = 12%); {@code totalReturn} is an amount
 * in the ledger currency. Sortino, Calmar and profit factor may be
 * {@link Double#POSITIVE_INFINITY}; that is a valid value, not an error.
 */
public record BacktestMetrics(
        double initialCapital,
        double finalEquity,
        double totalReturn,
        double totalReturnPct,
        double annualizedReturn,
        MaxDrawdown maxDrawdown,
        double volatility,
        double sharpeRatio,
        double sortinoRatio,
        double calmarRatio,
        TradeStats tradeStats,
        PeriodStats periodStats
) {
}
