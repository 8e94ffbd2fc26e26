package org.nowstart.finpack.data.dto;

/**
 * Closed-trade statistics. Profit figures are in the ledger currency; {@code profitFactor}
 * is {@link Double#POSITIVE_INFINITY} when there are winning sells but no losing ones.
 */
public record TradeStats(
        int totalTrades,
        int buyCount,
        int sellCount,
        int winCount,
        int lossCount,
        double winRate,
        double avgWin,
        double avgLoss,
        double profitFactor,
        double avgHoldingDays,
        double totalFees
) {
}
