package org.nowstart.finpack.service;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.nowstart.finpack.data.dto.BacktestMetrics;
import org.nowstart.finpack.data.dto.DayReturn;
import org.nowstart.finpack.data.dto.EquitySnapshot;
import org.nowstart.finpack.data.dto.MaxDrawdown;
import org.nowstart.finpack.data.dto.PeriodStats;
import org.nowstart.finpack.data.dto.TradeRecord;
import org.nowstart.finpack.data.dto.TradeStats;
import org.nowstart.finpack.data.type.TradeAction;
import org.springframework.stereotype.Service;

/**
 * Performance statistics of a finished run. Pure function of the equity curve and the trade log.
 */
@Service
public class PerformanceReportService {

    static final double TRADING_DAYS_PER_YEAR = 252.0;
    static final double DAYS_PER_YEAR = 365.25;

    private static final String RULE = "=".repeat(50);
    private static final String SUB_RULE = "-".repeat(30);

    public BacktestMetrics calculate(double initialCapital, List<EquitySnapshot> equity, List<TradeRecord> trades, double riskFreeRate) {
        if (equity.size() < 2) {
            double finalEquity = equity.isEmpty() ? initialCapital : equity.get(equity.size() - 1).equity();
            return new BacktestMetrics(
                    initialCapital,
                    finalEquity,
                    0.0,
                    0.0,
                    0.0,
                    MaxDrawdown.none(),
                    0.0,
                    0.0,
                    0.0,
                    0.0,
                    tradeStats(trades),
                    PeriodStats.empty()
            );
        }

        double finalEquity = equity.get(equity.size() - 1).equity();
        double annualizedReturn = annualizedReturn(equity);
        MaxDrawdown maxDrawdown = maxDrawdown(equity);
        double[] returns = dailyReturns(equity);

        return new BacktestMetrics(
                initialCapital,
                finalEquity,
                finalEquity - initialCapital,
                (finalEquity - initialCapital) / initialCapital,
                annualizedReturn,
                maxDrawdown,
                volatility(returns),
                sharpeRatio(returns, riskFreeRate),
                sortinoRatio(returns, riskFreeRate),
                maxDrawdown.value() == 0.0 ? Double.POSITIVE_INFINITY : annualizedReturn / maxDrawdown.value(),
                tradeStats(trades),
                periodStats(equity)
        );
    }

    /**
     * Compound annual growth between the first and last snapshot; zero when they share a date.
     */
    double annualizedReturn(List<EquitySnapshot> equity) {
        EquitySnapshot first = equity.get(0);
        EquitySnapshot last = equity.get(equity.size() - 1);
        double years = ChronoUnit.DAYS.between(first.date(), last.date()) / DAYS_PER_YEAR;
        if (years <= 0.0 || first.equity() <= 0.0) {
            return 0.0;
        }
        return Math.pow(last.equity() / first.equity(), 1.0 / years) - 1.0;
    }

    MaxDrawdown maxDrawdown(List<EquitySnapshot> equity) {
        double peak = equity.get(0).equity();
        LocalDate peakDate = equity.get(0).date();
        double worst = 0.0;
        LocalDate worstStart = null;
        LocalDate worstEnd = null;

        for (int i = 1; i < equity.size(); i++) {
            EquitySnapshot snapshot = equity.get(i);
            if (snapshot.equity() > peak) {
                peak = snapshot.equity();
                peakDate = snapshot.date();
            }
            double drawdown = peak > 0.0 ? (peak - snapshot.equity()) / peak : 0.0;
            if (drawdown > worst) {
                worst = drawdown;
                worstStart = peakDate;
                worstEnd = snapshot.date();
            }
        }
        return worst == 0.0 ? MaxDrawdown.none() : new MaxDrawdown(worst, worstStart, worstEnd);
    }

    double volatility(double[] returns) {
        if (returns.length < 2) {
            return 0.0;
        }
        return sampleStdDev(returns) * Math.sqrt(TRADING_DAYS_PER_YEAR);
    }

    double sharpeRatio(double[] returns, double riskFreeRate) {
        if (returns.length < 2) {
            return 0.0;
        }
        double stdDev = sampleStdDev(returns);
        if (stdDev == 0.0) {
            return 0.0;
        }
        return (mean(returns) * TRADING_DAYS_PER_YEAR - riskFreeRate) / (stdDev * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    /**
     * Downside deviation is the root mean square of the negative returns. No negative return
     * at all is reported as {@link Double#POSITIVE_INFINITY}.
     */
    double sortinoRatio(double[] returns, double riskFreeRate) {
        if (returns.length < 2) {
            return 0.0;
        }
        double squares = 0.0;
        int negatives = 0;
        for (double value : returns) {
            if (value < 0.0) {
                squares += value * value;
                negatives++;
            }
        }
        if (negatives == 0) {
            return Double.POSITIVE_INFINITY;
        }
        double downside = Math.sqrt(squares / negatives);
        return (mean(returns) * TRADING_DAYS_PER_YEAR - riskFreeRate) / (downside * Math.sqrt(TRADING_DAYS_PER_YEAR));
    }

    TradeStats tradeStats(List<TradeRecord> trades) {
        int buyCount = 0;
        double totalFees = 0.0;
        List<TradeRecord> sells = new ArrayList<>();
        for (TradeRecord trade : trades) {
            totalFees += trade.fee();
            if (trade.action() == TradeAction.BUY) {
                buyCount++;
            } else {
                sells.add(trade);
            }
        }
        if (sells.isEmpty()) {
            return new TradeStats(trades.size(), buyCount, 0, 0, 0, 0.0, 0.0, 0.0, 0.0, 0.0, totalFees);
        }

        int winCount = 0;
        double totalWin = 0.0;
        double totalLoss = 0.0;
        double holdingDays = 0.0;
        for (TradeRecord sell : sells) {
            double profit = sell.profitLedger() == null ? 0.0 : sell.profitLedger();
            if (profit > 0.0) {
                winCount++;
                totalWin += profit;
            } else {
                totalLoss += Math.abs(profit);
            }
            holdingDays += sell.holdingDays() == null ? 0 : sell.holdingDays();
        }
        int lossCount = sells.size() - winCount;

        return new TradeStats(
                trades.size(),
                buyCount,
                sells.size(),
                winCount,
                lossCount,
                (double) winCount / sells.size(),
                winCount > 0 ? totalWin / winCount : 0.0,
                lossCount > 0 ? totalLoss / lossCount : 0.0,
                totalLoss > 0.0 ? totalWin / totalLoss : Double.POSITIVE_INFINITY,
                holdingDays / sells.size(),
                totalFees
        );
    }

    PeriodStats periodStats(List<EquitySnapshot> equity) {
        DayReturn best = null;
        DayReturn worst = null;
        for (int i = 1; i < equity.size(); i++) {
            DayReturn day = new DayReturn(equity.get(i).date(), dailyReturn(equity.get(i - 1), equity.get(i)));
            if (best == null || day.value() > best.value()) {
                best = day;
            }
            if (worst == null || day.value() < worst.value()) {
                worst = day;
            }
        }
        return new PeriodStats(
                equity.size(),
                equity.get(0).date(),
                equity.get(equity.size() - 1).date(),
                best,
                worst
        );
    }

    public String formatSummary(BacktestMetrics metrics) {
        TradeStats trades = metrics.tradeStats();
        PeriodStats period = metrics.periodStats();
        List<String> lines = new ArrayList<>();
        lines.add(RULE);
        lines.add("Backtest performance report");
        lines.add(RULE);
        lines.add("[Return]");
        lines.add(SUB_RULE);
        lines.add("Total return: " + formatAmount(metrics.totalReturn()) + " (" + formatPercent(metrics.totalReturnPct()) + ")");
        lines.add("Annualized return: " + formatPercent(metrics.annualizedReturn()));
        lines.add("[Risk]");
        lines.add(SUB_RULE);
        lines.add("Max drawdown: " + formatPercent(metrics.maxDrawdown().value())
                + " (" + metrics.maxDrawdown().startDate() + " -> " + metrics.maxDrawdown().endDate() + ")");
        lines.add("Volatility: " + formatPercent(metrics.volatility()));
        lines.add("[Risk adjusted]");
        lines.add(SUB_RULE);
        lines.add("Sharpe ratio: " + formatRatio(metrics.sharpeRatio()));
        lines.add("Sortino ratio: " + formatRatio(metrics.sortinoRatio()));
        lines.add("Calmar ratio: " + formatRatio(metrics.calmarRatio()));
        lines.add("[Trades]");
        lines.add(SUB_RULE);
        lines.add("Total trades: " + trades.totalTrades() + " (buy " + trades.buyCount() + ", sell " + trades.sellCount() + ")");
        lines.add("Win rate: " + formatPercent(trades.winRate()) + " (" + trades.winCount() + "/" + trades.sellCount() + ")");
        lines.add("Profit factor: " + formatRatio(trades.profitFactor()));
        lines.add(String.format(Locale.US, "Avg holding days: %.1f", trades.avgHoldingDays()));
        lines.add("Total fees: " + formatAmount(trades.totalFees()));
        lines.add("[Period]");
        lines.add(SUB_RULE);
        lines.add("Trading days: " + period.tradingDays());
        lines.add("Range: " + period.startDate() + " ~ " + period.endDate());
        lines.add("Best day: " + period.bestDay().date() + " (" + formatPercent(period.bestDay().value()) + ")");
        lines.add("Worst day: " + period.worstDay().date() + " (" + formatPercent(period.worstDay().value()) + ")");
        lines.add(RULE);
        return String.join(System.lineSeparator(), lines);
    }

    static String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return value > 0 ? "inf" : "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }

    private static String formatRatio(double value) {
        if (Double.isInfinite(value)) {
            return value > 0 ? "inf" : "-inf";
        }
        return String.format(Locale.US, "%.2f", value);
    }

    private static String formatAmount(double value) {
        return String.format(Locale.US, "%,.0f TWD", value);
    }

    private static double[] dailyReturns(List<EquitySnapshot> equity) {
        double[] returns = new double[equity.size() - 1];
        for (int i = 1; i < equity.size(); i++) {
            returns[i - 1] = dailyReturn(equity.get(i - 1), equity.get(i));
        }
        return returns;
    }

    private static double dailyReturn(EquitySnapshot previous, EquitySnapshot current) {
        return previous.equity() == 0.0 ? 0.0 : (current.equity() - previous.equity()) / previous.equity();
    }

    private static double mean(double[] values) {
        double sum = 0.0;
        for (double value : values) {
            sum += value;
        }
        return sum / values.length;
    }

    private static double sampleStdDev(double[] values) {
        double mean = mean(values);
        double squares = 0.0;
        for (double value : values) {
            squares += (value - mean) * (value - mean);
        }
        return Math.sqrt(squares / (values.length - 1));
    }
}
