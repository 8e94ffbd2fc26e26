package org.nowstart.finpack.ledger;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.finpack.data.dto.RebalanceResult;
import org.nowstart.finpack.data.dto.TickerInfo;
import org.nowstart.finpack.data.dto.TradeResult;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.TradeRejection;

/**
 * Sizes orders and hands them to the {@link Portfolio}. Budgets are in the ledger currency.
 */
@Slf4j
public class TradeExecutor {

    public static final String REBALANCE_REASON = "rebalance";

    private final Portfolio portfolio;
    private final double amountPerStock;
    private final int maxPositions;
    private final TradingOptions options;

    public TradeExecutor(Portfolio portfolio, double amountPerStock, int maxPositions, TradingOptions options) {
        if (!Double.isFinite(amountPerStock) || amountPerStock <= 0.0) {
            throw new IllegalArgumentException("amount per stock must be > 0");
        }
        if (maxPositions <= 0) {
            throw new IllegalArgumentException("max positions must be > 0");
        }
        this.portfolio = portfolio;
        this.amountPerStock = amountPerStock;
        this.maxPositions = maxPositions;
        this.options = options == null ? TradingOptions.defaults() : options;
    }

    public Portfolio portfolio() {
        return portfolio;
    }

    public int maxPositions() {
        return maxPositions;
    }

    public double amountPerStock() {
        return amountPerStock;
    }

    public TradingOptions options() {
        return options;
    }

    public boolean hasFreeSlot() {
        return portfolio.positionCount() < maxPositions;
    }

    public TradeResult executeBuy(String ticker, double price, Country country, LocalDate date, double exchangeRate) {
        return executeBuy(ticker, price, country, date, amountPerStock, exchangeRate);
    }

    /**
     * Buys roughly {@code budget} worth of {@code ticker}, rounded down to a tradable quantity.
     * A new ticker is refused once the position ceiling is reached; adding to a holding is not.
     */
    public TradeResult executeBuy(String ticker, double price, Country country, LocalDate date, double budget, double exchangeRate) {
        if (!portfolio.hasPosition(ticker) && portfolio.positionCount() >= maxPositions) {
            return rejected(ticker, TradeRejection.MAX_POSITIONS_REACHED);
        }
        if (!(price > 0.0) || !(budget > 0.0)) {
            return rejected(ticker, TradeRejection.AMOUNT_TOO_SMALL);
        }

        double unitCost = country.toLedger(price, exchangeRate);
        double shares = options.roundShares(budget / unitCost, country);
        if (shares <= 0.0) {
            return rejected(ticker, TradeRejection.AMOUNT_TOO_SMALL);
        }

        double ledgerAmount = shares * unitCost;
        double totalCost = ledgerAmount + portfolio.calculateFee(ledgerAmount, country);
        if (totalCost > portfolio.cash()) {
            if (!options.allowPartialFill()) {
                return rejected(ticker, TradeRejection.INSUFFICIENT_CASH);
            }
            shares = maxAffordableShares(unitCost, country);
            if (shares <= 0.0) {
                return rejected(ticker, TradeRejection.INSUFFICIENT_CASH);
            }
            log.debug("event=partial_fill ticker={} shares={} cash={}", ticker, shares, portfolio.cash());
        }

        TradeResult result = portfolio.buy(ticker, shares, price, country, date, exchangeRate);
        if (!result.success()) {
            log.debug("event=buy_rejected ticker={} reason={}", ticker, result.reason());
        }
        return result;
    }

    public TradeResult executeSell(String ticker, double price, LocalDate date, String reason, double exchangeRate) {
        return executeSell(ticker, Portfolio.SELL_ALL, price, date, reason, exchangeRate);
    }

    public TradeResult executeSell(String ticker, double shares, double price, LocalDate date, String reason, double exchangeRate) {
        TradeResult result = portfolio.sell(ticker, shares, price, date, reason, exchangeRate);
        if (!result.success()) {
            log.debug("event=sell_rejected ticker={} reason={}", ticker, result.reason());
        }
        return result;
    }

    /**
     * Closes every holding that has a price.
     */
    public List<TradeResult> executeSellAll(Map<String, Double> prices, LocalDate date, String reason, double exchangeRate) {
        List<TradeResult> results = new ArrayList<>();
        for (String ticker : portfolio.holdings()) {
            Double price = prices.get(ticker);
            if (price != null) {
                results.add(executeSell(ticker, price, date, reason, exchangeRate));
            }
        }
        return results;
    }

    /**
     * Sells holdings outside {@code targets}, then buys targets not yet held at the standard size.
     */
    public RebalanceResult executeRebalance(
            List<String> targets,
            Map<String, Double> prices,
            Map<String, TickerInfo> stockInfo,
            LocalDate date,
            double exchangeRate
    ) {
        Set<String> targetSet = new LinkedHashSet<>(targets);
        List<TradeResult> sells = new ArrayList<>();
        for (String ticker : portfolio.holdings()) {
            if (targetSet.contains(ticker)) {
                continue;
            }
            Double price = prices.get(ticker);
            if (price != null) {
                sells.add(executeSell(ticker, price, date, REBALANCE_REASON, exchangeRate));
            }
        }

        List<TradeResult> buys = new ArrayList<>();
        for (String ticker : targetSet) {
            if (portfolio.hasPosition(ticker)) {
                continue;
            }
            Double price = prices.get(ticker);
            TickerInfo info = stockInfo.get(ticker);
            if (price != null && info != null) {
                buys.add(executeBuy(ticker, price, info.country(), date, exchangeRate));
            }
        }
        return new RebalanceResult(List.copyOf(sells), List.copyOf(buys));
    }

    double maxAffordableShares(double unitCost, Country country) {
        double cash = portfolio.cash();
        FeeRule rule = portfolio.fees().rule(country);
        double shares = options.roundShares(cash / (unitCost * (1.0 + rule.rate())), country);
        if (shares > 0.0 && shares * unitCost + rule.fee(shares * unitCost) > cash) {
            // the minimum fee dominates for small orders
            shares = options.roundShares((cash - rule.minFee()) / unitCost, country);
        }
        if (shares > 0.0 && shares * unitCost + rule.fee(shares * unitCost) > cash) {
            return 0.0;
        }
        return shares;
    }

    private TradeResult rejected(String ticker, TradeRejection rejection) {
        log.debug("event=buy_rejected ticker={} reason={}", ticker, rejection.code());
        return TradeResult.rejected(ticker, rejection);
    }
}
