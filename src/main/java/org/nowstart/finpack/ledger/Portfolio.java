package org.nowstart.finpack.ledger;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.nowstart.finpack.data.dto.EquitySnapshot;
import org.nowstart.finpack.data.dto.HoldingSnapshot;
import org.nowstart.finpack.data.dto.PortfolioValue;
import org.nowstart.finpack.data.dto.TickerInfo;
import org.nowstart.finpack.data.dto.TradeRecord;
import org.nowstart.finpack.data.dto.TradeResult;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.TradeAction;
import org.nowstart.finpack.data.type.TradeRejection;

/**
 * Cash and position ledger.
 *
 * <p>Cash is tracked in the ledger currency (TWD). Prices, average costs and realized profit
 * stay in each instrument's native currency; conversion happens once, here, with the
 * exchange rate the caller passes for the trade date.
 */
public class Portfolio {

    public static final double SELL_ALL = 0.0;

    private static final double SHARE_EPSILON = 1e-9;

    private final double initialCapital;
    private final FeeSchedule fees;
    private final Map<String, Position> positions = new LinkedHashMap<>();
    private final List<EquitySnapshot> history = new ArrayList<>();
    private final List<TradeRecord> tradeLog = new ArrayList<>();
    private double cash;

    public Portfolio(double initialCapital, FeeSchedule fees) {
        if (!Double.isFinite(initialCapital) || initialCapital <= 0.0) {
            throw new IllegalArgumentException("initial capital must be > 0");
        }
        this.initialCapital = initialCapital;
        this.fees = fees == null ? FeeSchedule.defaults() : fees;
        reset();
    }

    public void reset() {
        cash = initialCapital;
        positions.clear();
        history.clear();
        tradeLog.clear();
    }

    public double initialCapital() {
        return initialCapital;
    }

    public double cash() {
        return cash;
    }

    public FeeSchedule fees() {
        return fees;
    }

    public Map<String, Position> positions() {
        return Collections.unmodifiableMap(positions);
    }

    public List<String> holdings() {
        return List.copyOf(positions.keySet());
    }

    public Optional<Position> findPosition(String ticker) {
        return Optional.ofNullable(positions.get(ticker));
    }

    public boolean hasPosition(String ticker) {
        return positions.containsKey(ticker);
    }

    public int positionCount() {
        return positions.size();
    }

    public double calculateFee(double ledgerAmount, Country country) {
        return fees.fee(ledgerAmount, country);
    }

    public TradeResult buy(String ticker, double shares, double price, Country country, LocalDate date, double exchangeRate) {
        if (!(shares > 0.0) || !(price > 0.0)) {
            return TradeResult.rejected(ticker, TradeRejection.AMOUNT_TOO_SMALL);
        }

        double amount = shares * price;
        double ledgerAmount = country.toLedger(amount, exchangeRate);
        double fee = calculateFee(ledgerAmount, country);
        double totalCost = ledgerAmount + fee;
        if (totalCost > cash) {
            return TradeResult.rejected(ticker, TradeRejection.INSUFFICIENT_CASH, totalCost, cash);
        }

        cash -= totalCost;
        Position existing = positions.get(ticker);
        if (existing != null) {
            existing.add(shares, amount);
        } else {
            positions.put(ticker, new Position(ticker, country, date, shares, price));
        }

        TradeRecord trade = TradeRecord.builder()
                .action(TradeAction.BUY)
                .ticker(ticker)
                .date(date)
                .country(country)
                .shares(shares)
                .price(price)
                .amount(amount)
                .ledgerAmount(ledgerAmount)
                .exchangeRate(country.effectiveRate(exchangeRate))
                .fee(fee)
                .cashFlow(-totalCost)
                .reason("buy")
                .build();
        tradeLog.add(trade);
        return TradeResult.filled(trade);
    }

    /**
     * Sells {@code shares} of a holding; {@link #SELL_ALL} closes the whole position.
     * Requests above the held quantity are rejected, never clamped.
     */
    public TradeResult sell(String ticker, double shares, double price, LocalDate date, String reason, double exchangeRate) {
        Position position = positions.get(ticker);
        if (position == null) {
            return TradeResult.rejected(ticker, TradeRejection.NO_POSITION);
        }

        double sellShares = shares == SELL_ALL ? position.getShares() : shares;
        if (sellShares < 0.0) {
            return TradeResult.rejected(ticker, TradeRejection.AMOUNT_TOO_SMALL);
        }
        if (sellShares > position.getShares() + SHARE_EPSILON) {
            return TradeResult.rejected(ticker, TradeRejection.INSUFFICIENT_SHARES, sellShares, position.getShares());
        }

        Country country = position.getCountry();
        double amount = sellShares * price;
        double ledgerAmount = country.toLedger(amount, exchangeRate);
        double fee = calculateFee(ledgerAmount, country);
        double netProceeds = ledgerAmount - fee;

        double costBasis = sellShares * position.getAvgCost();
        double profit = amount - costBasis;
        double profitPct = costBasis > 0.0 ? profit / costBasis : 0.0;

        cash += netProceeds;
        if (Math.abs(sellShares - position.getShares()) <= SHARE_EPSILON) {
            positions.remove(ticker);
        } else {
            position.reduce(sellShares);
        }

        TradeRecord trade = TradeRecord.builder()
                .action(TradeAction.SELL)
                .ticker(ticker)
                .date(date)
                .country(country)
                .shares(sellShares)
                .price(price)
                .amount(amount)
                .ledgerAmount(ledgerAmount)
                .exchangeRate(country.effectiveRate(exchangeRate))
                .fee(fee)
                .cashFlow(netProceeds)
                .profit(profit)
                .profitLedger(country.toLedger(profit, exchangeRate))
                .profitPct(profitPct)
                .entryDate(position.getEntryDate())
                .holdingDays(holdingDays(position.getEntryDate(), date))
                .reason(reason == null ? "" : reason)
                .build();
        tradeLog.add(trade);
        return TradeResult.filled(trade);
    }

    /**
     * Marks open positions to {@code prices}; a ticker without a price is valued at its average cost.
     */
    public PortfolioValue calculateValue(Map<String, Double> prices, double exchangeRate) {
        double positionValue = 0.0;
        for (Position position : positions.values()) {
            positionValue += marketValue(position, priceOrCost(prices, position), exchangeRate);
        }
        return new PortfolioValue(cash, positionValue, cash + positionValue);
    }

    /**
     * Appends the end-of-day snapshot. Must run once per simulated day after all trades.
     */
    public EquitySnapshot recordHistory(LocalDate date, Map<String, Double> prices, Map<String, TickerInfo> stockInfo, double exchangeRate) {
        Map<String, HoldingSnapshot> holdings = new LinkedHashMap<>();
        double positionValue = 0.0;
        for (Position position : positions.values()) {
            double currentPrice = priceOrCost(prices, position);
            double marketValue = marketValue(position, currentPrice, exchangeRate);
            positionValue += marketValue;

            TickerInfo info = stockInfo == null ? null : stockInfo.get(position.getTicker());
            holdings.put(position.getTicker(), new HoldingSnapshot(
                    position.getShares(),
                    position.getAvgCost(),
                    currentPrice,
                    marketValue,
                    position.getAvgCost() > 0.0 ? (currentPrice - position.getAvgCost()) / position.getAvgCost() : 0.0,
                    position.getEntryDate(),
                    info == null ? "" : info.industry(),
                    position.getCountry(),
                    position.getCountry().effectiveRate(exchangeRate)
            ));
        }

        EquitySnapshot snapshot = new EquitySnapshot(
                date,
                cash,
                positionValue,
                cash + positionValue,
                holdings,
                positions.size()
        );
        history.add(snapshot);
        return snapshot;
    }

    public List<EquitySnapshot> equityCurve() {
        return List.copyOf(history);
    }

    public List<TradeRecord> tradeLog() {
        return List.copyOf(tradeLog);
    }

    static int holdingDays(LocalDate entryDate, LocalDate exitDate) {
        if (entryDate == null || exitDate == null) {
            return 0;
        }
        return (int) Math.abs(ChronoUnit.DAYS.between(entryDate, exitDate));
    }

    private double priceOrCost(Map<String, Double> prices, Position position) {
        Double price = prices == null ? null : prices.get(position.getTicker());
        return price != null && Double.isFinite(price) ? price : position.getAvgCost();
    }

    private double marketValue(Position position, double price, double exchangeRate) {
        return position.getCountry().toLedger(position.getShares() * price, exchangeRate);
    }
}
