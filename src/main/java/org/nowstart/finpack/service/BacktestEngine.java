package org.nowstart.finpack.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.finpack.data.dto.BacktestMetrics;
import org.nowstart.finpack.data.dto.BacktestProgress;
import org.nowstart.finpack.data.dto.BacktestRequest;
import org.nowstart.finpack.data.dto.BacktestResult;
import org.nowstart.finpack.data.dto.BenchmarkPoint;
import org.nowstart.finpack.data.dto.DateAdjustment;
import org.nowstart.finpack.data.dto.EquitySnapshot;
import org.nowstart.finpack.data.dto.FinalPosition;
import org.nowstart.finpack.data.dto.MarketDataBundle;
import org.nowstart.finpack.data.dto.RebalanceResult;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.data.dto.TickerInfo;
import org.nowstart.finpack.data.dto.TradeResult;
import org.nowstart.finpack.data.exception.BacktestException;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.RunState;
import org.nowstart.finpack.ledger.Portfolio;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.ledger.TradeExecutor;
import org.nowstart.finpack.strategy.buy.BuyConditionPipeline;
import org.nowstart.finpack.strategy.buy.BuyConditionRegistry;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.MarketDataView;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RuleDescription;
import org.nowstart.finpack.strategy.core.SelectionHistory;
import org.nowstart.finpack.strategy.rebalance.ConfiguredRebalanceStrategy;
import org.nowstart.finpack.strategy.rebalance.RebalanceStrategyRegistry;
import org.nowstart.finpack.strategy.sell.SellConditionRegistry;
import org.nowstart.finpack.strategy.sell.SellConditionSet;
import org.springframework.stereotype.Service;

/**
 * Day-by-day simulation over a {@link MarketDataBundle}.
 *
 * <p>Each trading day runs, in order: peak update, sell conditions, buy pipeline (appended to the
 * selection history), rebalance on cadence days when the strategy allows it, slot filling when the
 * strategy allows it, and the end-of-day snapshot. One run at a time per instance; {@link #run}
 * never throws.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class BacktestEngine {

    private final BuyConditionRegistry buyConditionRegistry;
    private final SellConditionRegistry sellConditionRegistry;
    private final RebalanceStrategyRegistry rebalanceStrategyRegistry;
    private final PerformanceReportService performanceReportService;
    private final BenchmarkService benchmarkService;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile RunState state = RunState.NOT_STARTED;

    public RunState state() {
        return state;
    }

    public BacktestResult run(MarketDataBundle bundle, BacktestRequest request) {
        if (!running.compareAndSet(false, true)) {
            log.warn("event=backtest_rejected reason={}", BacktestException.ALREADY_RUNNING);
            return BacktestResult.failure(BacktestException.ALREADY_RUNNING, "A backtest is already running");
        }

        state = RunState.RUNNING;
        try {
            BacktestResult result = simulate(bundle, request);
            state = result.success() ? RunState.COMPLETED : RunState.FAILED;
            return result;
        } catch (BacktestException e) {
            state = RunState.FAILED;
            log.warn("event=backtest_invalid code={} message={}", e.getCode(), e.getMessage());
            return BacktestResult.failure(e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            state = RunState.FAILED;
            log.error("event=backtest_failed message={}", e.getMessage(), e);
            return BacktestResult.failure(BacktestException.INTERNAL_ERROR, "Backtest failed: " + e.getMessage());
        } finally {
            running.set(false);
        }
    }

    /**
     * Resolved rules with their effective parameters, in pipeline order.
     */
    public List<RuleDescription> describe(BacktestRequest request) {
        List<RuleDescription> descriptions = new ArrayList<>();
        buyConditionRegistry.resolve(request.buyConditions()).conditions()
                .forEach(condition -> descriptions.add(condition.describe()));
        sellConditionRegistry.resolve(request.sellConditions()).conditions()
                .forEach(condition -> descriptions.add(condition.describe()));
        descriptions.add(rebalanceStrategyRegistry.resolve(request.rebalance()).describe());
        return List.copyOf(descriptions);
    }

    private BacktestResult simulate(MarketDataBundle bundle, BacktestRequest request) {
        validateBundle(bundle);
        validateRequest(request);

        BuyConditionPipeline buyPipeline = buyConditionRegistry.resolve(request.buyConditions());
        if (!buyPipeline.hasCategory(ConditionCategory.A)) {
            throw new BacktestException(BacktestException.INVALID_REQUEST, "At least one category A buy condition must be enabled");
        }
        SellConditionSet sellConditions = sellConditionRegistry.resolve(request.sellConditions());
        ConfiguredRebalanceStrategy<?> rebalance = rebalanceStrategyRegistry.resolve(request.rebalance());

        MarketDataView data = MarketDataView.of(
                bundle,
                request.market(),
                request.excludedSectors(),
                request.tradingOptions().defaultExchangeRate()
        );
        List<LocalDate> tradingDates = data.dates().stream()
                .filter(date -> !date.isBefore(request.startDate()) && !date.isAfter(request.endDate()))
                .toList();
        DateAdjustment adjustment = adjustDates(request, data.dates(), tradingDates);
        if (tradingDates.isEmpty()) {
            String available = data.dates().isEmpty()
                    ? "N/A"
                    : data.dates().get(0) + " ~ " + data.dates().get(data.dates().size() - 1);
            log.warn("event=backtest_no_trading_days configuredStart={} configuredEnd={} available={}",
                    request.startDate(), request.endDate(), available);
            return BacktestResult.failure(
                    BacktestException.NO_TRADING_DAYS,
                    "No trading days in the requested range; data covers " + available,
                    adjustment
            );
        }

        log.info("event=backtest_start market={} configuredStart={} configuredEnd={} actualStart={} actualEnd={} tradingDays={} buy={} sell={} rebalance={} frequency={}",
                request.market(),
                adjustment.configuredStart(),
                adjustment.configuredEnd(),
                adjustment.actualStart(),
                adjustment.actualEnd(),
                adjustment.tradingDays(),
                buyPipeline.conditions().stream().map(condition -> condition.id()).toList(),
                sellConditions.conditions().stream().map(condition -> condition.id()).toList(),
                rebalance.id(),
                request.rebalanceFrequency());

        Portfolio portfolio = new Portfolio(request.initialCapital(), request.fees());
        TradeExecutor executor = new TradeExecutor(
                portfolio,
                request.amountPerStock(),
                request.maxPositions(),
                request.tradingOptions()
        );
        SelectionHistory selectionHistory = new SelectionHistory();

        LocalDate previousDate = null;
        Map<String, Double> lastPrices = Map.of();
        double lastExchangeRate = request.tradingOptions().defaultExchangeRate();
        for (int i = 0; i < tradingDates.size(); i++) {
            LocalDate date = tradingDates.get(i);
            Map<String, Double> prices = data.pricesOn(date);
            double exchangeRate = data.exchangeRate(date);

            observePeaks(portfolio, prices);

            processSells(executor, sellConditions, new EvaluationContext(
                    date, data, prices, exchangeRate, selectionHistory, portfolio.holdings()));

            EvaluationContext context = new EvaluationContext(
                    date, data, prices, exchangeRate, selectionHistory, portfolio.holdings());
            List<String> selected = buyPipeline.apply(data.universe(), context);
            selectionHistory.append(date, selected);

            boolean authorized = rebalance.shouldRebalance(new RebalanceContext(portfolio.holdings(), selected, context));
            if (authorized && request.rebalanceFrequency().isRebalanceDay(previousDate, date)) {
                RebalanceResult rebalanced = rebalance.execute(executor, selected, context);
                logRejections(date, "rebalance_sell_rejected", rebalanced.sells());
                logRejections(date, "rebalance_buy_rejected", rebalanced.buys());
            }
            if (authorized && rebalance.fillsOpenSlots()) {
                fillSlots(executor, selected, context);
            }

            EquitySnapshot snapshot = portfolio.recordHistory(date, prices, data.stockInfo(), exchangeRate);
            notifyProgress(request.progressListener(), new BacktestProgress(i + 1, tradingDates.size(), date, snapshot.equity()));

            previousDate = date;
            lastPrices = prices;
            lastExchangeRate = exchangeRate;
        }

        BacktestMetrics metrics = performanceReportService.calculate(
                request.initialCapital(),
                portfolio.equityCurve(),
                portfolio.tradeLog(),
                request.riskFreeRate()
        );
        List<BenchmarkPoint> benchmark = benchmarkService.curve(data, tradingDates, request.initialCapital());

        log.info("event=backtest_completed tradingDays={} finalEquity={} totalReturnPct={} trades={} openPositions={}",
                tradingDates.size(),
                metrics.finalEquity(),
                PerformanceReportService.formatPercent(metrics.totalReturnPct()),
                portfolio.tradeLog().size(),
                portfolio.positionCount());

        return BacktestResult.success(
                metrics,
                portfolio.equityCurve(),
                portfolio.tradeLog(),
                finalPositions(portfolio, lastPrices, lastExchangeRate),
                selectionHistory.asMap(),
                adjustment,
                benchmark
        );
    }

    private void validateBundle(MarketDataBundle bundle) {
        if (bundle == null) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Market data bundle is required");
        }
        if (bundle.dates() == null || bundle.prices() == null || bundle.stockInfo() == null) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Market data bundle requires dates, prices and stockInfo");
        }
        if (bundle.dates().stream().anyMatch(date -> date == null)) {
            throw new BacktestException(BacktestException.INVALID_BUNDLE, "Market data bundle contains a null date");
        }
    }

    private void validateRequest(BacktestRequest request) {
        if (request == null) {
            throw new BacktestException(BacktestException.INVALID_REQUEST, "Backtest request is required");
        }
        if (request.startDate() == null || request.endDate() == null) {
            throw new BacktestException(BacktestException.INVALID_REQUEST, "Start and end dates are required");
        }
        if (request.startDate().isAfter(request.endDate())) {
            throw new BacktestException(BacktestException.INVALID_REQUEST,
                    "Start date " + request.startDate() + " is after end date " + request.endDate());
        }
        if (!(request.initialCapital() > 0.0) || !(request.amountPerStock() > 0.0)) {
            throw new BacktestException(BacktestException.INVALID_REQUEST, "Initial capital and amount per stock must be > 0");
        }
        if (request.maxPositions() <= 0) {
            throw new BacktestException(BacktestException.INVALID_REQUEST, "Max positions must be > 0");
        }
    }

    private DateAdjustment adjustDates(BacktestRequest request, List<LocalDate> available, List<LocalDate> tradingDates) {
        LocalDate actualStart = tradingDates.isEmpty() ? null : tradingDates.get(0);
        LocalDate actualEnd = tradingDates.isEmpty() ? null : tradingDates.get(tradingDates.size() - 1);
        boolean startAdjusted = actualStart != null && !actualStart.equals(request.startDate());
        boolean endAdjusted = actualEnd != null && !actualEnd.equals(request.endDate());
        if (startAdjusted) {
            log.warn("event=backtest_start_adjusted configured={} actual={}", request.startDate(), actualStart);
        }
        if (endAdjusted) {
            log.warn("event=backtest_end_adjusted configured={} actual={}", request.endDate(), actualEnd);
        }
        return new DateAdjustment(
                request.startDate(),
                request.endDate(),
                actualStart,
                actualEnd,
                startAdjusted,
                endAdjusted,
                available.size(),
                tradingDates.size()
        );
    }

    private void observePeaks(Portfolio portfolio, Map<String, Double> prices) {
        for (Position position : portfolio.positions().values()) {
            Double price = prices.get(position.getTicker());
            if (price != null) {
                position.observePrice(price);
            }
        }
    }

    private void processSells(TradeExecutor executor, SellConditionSet sellConditions, EvaluationContext context) {
        if (sellConditions.isEmpty()) {
            return;
        }
        Portfolio portfolio = executor.portfolio();
        for (String ticker : portfolio.holdings()) {
            Position position = portfolio.findPosition(ticker).orElse(null);
            Double price = context.price(ticker);
            if (position == null || price == null) {
                continue;
            }
            SellDecision decision = sellConditions.evaluate(position, context);
            if (decision.shouldSell()) {
                TradeResult result = executor.executeSell(ticker, price, context.date(), decision.reason(), context.exchangeRate());
                log.debug("event=sell_signal date={} ticker={} reason={} success={}",
                        context.date(), ticker, decision.reason(), result.success());
            }
        }
    }

    private void fillSlots(TradeExecutor executor, List<String> selected, EvaluationContext context) {
        Portfolio portfolio = executor.portfolio();
        for (String ticker : selected) {
            if (!executor.hasFreeSlot()) {
                break;
            }
            if (portfolio.hasPosition(ticker)) {
                continue;
            }
            Double price = context.price(ticker);
            TickerInfo info = context.data().stockInfo().get(ticker);
            if (price != null && info != null) {
                executor.executeBuy(ticker, price, info.country(), context.date(), context.exchangeRate());
            }
        }
    }

    private void logRejections(LocalDate date, String stage, List<TradeResult> results) {
        for (TradeResult result : results) {
            if (!result.success()) {
                log.debug("event={} date={} ticker={} reason={}", stage, date, result.ticker(), result.reason());
            }
        }
    }

    private void notifyProgress(BacktestProgressListener listener, BacktestProgress progress) {
        if (listener == null) {
            return;
        }
        try {
            listener.onProgress(progress);
        } catch (RuntimeException e) {
            log.warn("event=backtest_progress_listener_failed date={} message={}", progress.date(), e.getMessage());
        }
    }

    private Map<String, FinalPosition> finalPositions(Portfolio portfolio, Map<String, Double> lastPrices, double exchangeRate) {
        Map<String, FinalPosition> positions = new LinkedHashMap<>();
        for (Position position : portfolio.positions().values()) {
            Double price = lastPrices.get(position.getTicker());
            double lastPrice = price == null ? position.getAvgCost() : price;
            Country country = position.getCountry();
            positions.put(position.getTicker(), new FinalPosition(
                    position.getTicker(),
                    position.getShares(),
                    position.getAvgCost(),
                    country,
                    position.getEntryDate(),
                    lastPrice,
                    country.effectiveRate(exchangeRate),
                    country.toLedger(position.getShares() * lastPrice, exchangeRate),
                    position.getAvgCost() > 0.0 ? (lastPrice - position.getAvgCost()) / position.getAvgCost() : 0.0
            ));
        }
        return positions;
    }
}
