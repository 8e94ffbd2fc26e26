package org.nowstart.finpack.runner;

import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.finpack.data.dto.BacktestProgress;
import org.nowstart.finpack.data.dto.BacktestRequest;
import org.nowstart.finpack.data.dto.BacktestResult;
import org.nowstart.finpack.data.dto.DateAdjustment;
import org.nowstart.finpack.data.dto.FinalPosition;
import org.nowstart.finpack.data.dto.MarketDataBundle;
import org.nowstart.finpack.data.exception.BacktestException;
import org.nowstart.finpack.data.property.BacktestProperties;
import org.nowstart.finpack.service.BacktestEngine;
import org.nowstart.finpack.service.BacktestRequestFactory;
import org.nowstart.finpack.service.BacktestResultWriter;
import org.nowstart.finpack.service.MarketDataBundleLoader;
import org.nowstart.finpack.service.PerformanceReportService;
import org.nowstart.finpack.strategy.core.RuleDescription;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@RequiredArgsConstructor
public class BacktestRunner implements ApplicationRunner {

    private final BacktestProperties properties;
    private final MarketDataBundleLoader bundleLoader;
    private final BacktestRequestFactory requestFactory;
    private final BacktestEngine backtestEngine;
    private final PerformanceReportService performanceReportService;
    private final BacktestResultWriter resultWriter;

    @Override
    public void run(ApplicationArguments args) {
        if (!properties.enabled()) {
            log.info("finpack.backtest.enabled=false; pass --finpack.backtest.enabled=true to run");
            return;
        }

        logSection("BACKTEST START");
        log.info("[Overview] market={} from={} to={} capital={} perStock={} maxPositions={} frequency={}",
                properties.market(),
                properties.startDate(),
                properties.endDate(),
                properties.initialCapital(),
                properties.amountPerStock(),
                properties.maxPositions(),
                properties.rebalanceFrequency());

        MarketDataBundle bundle;
        try {
            bundle = bundleLoader.load(Path.of(properties.inputPath()));
        } catch (BacktestException e) {
            log.error("[Overview] code={} error={}", e.getCode(), e.getMessage());
            logSection("BACKTEST END");
            return;
        }

        BacktestRequest request = requestFactory.create(properties, this::logProgress);
        BacktestResult result = backtestEngine.run(bundle, request);
        if (!result.success()) {
            log.error("[Result] failed code={} error={}", result.errorCode(), result.error());
            logDateAdjustment(result.dateAdjustment());
            writeResult(result);
            logSection("BACKTEST END");
            return;
        }

        logSection("RULES");
        logRules(backtestEngine.describe(request));

        logSection("DATES");
        logDateAdjustment(result.dateAdjustment());

        logSection("SUMMARY");
        performanceReportService.formatSummary(result.metrics()).lines().forEach(log::info);

        logSection("FINAL POSITIONS");
        logFinalPositions(List.copyOf(result.finalPositions().values()));

        writeResult(result);
        logSection("BACKTEST END");
    }

    private void logProgress(BacktestProgress progress) {
        if (progress.current() % properties.progressLogInterval() == 0 || progress.current() == progress.total()) {
            log.info("[Progress] {}/{} date={} equity={}",
                    progress.current(),
                    progress.total(),
                    progress.date(),
                    String.format(Locale.US, "%,.0f", progress.equity()));
        }
    }

    private void logRules(List<RuleDescription> rules) {
        for (RuleDescription rule : rules) {
            log.info("[Rule] kind={} id={} category={} params={}", rule.kind(), rule.id(), rule.category(), rule.params());
        }
    }

    private void logDateAdjustment(DateAdjustment adjustment) {
        if (adjustment == null) {
            return;
        }
        log.info("[Dates] configured={} -> {} actual={} -> {} tradingDays={}/{}",
                adjustment.configuredStart(),
                adjustment.configuredEnd(),
                adjustment.actualStart(),
                adjustment.actualEnd(),
                adjustment.tradingDays(),
                adjustment.availableDates());
    }

    private void logFinalPositions(List<FinalPosition> positions) {
        if (positions.isEmpty()) {
            log.info("[Position] none");
            return;
        }
        for (FinalPosition position : positions) {
            log.info("[Position] ticker={} country={} shares={} avgCost={} last={} value={} pnl={}",
                    position.ticker(),
                    position.country(),
                    position.shares(),
                    position.avgCost(),
                    position.lastPrice(),
                    String.format(Locale.US, "%,.0f", position.marketValue()),
                    formatPercent(position.unrealizedPct()));
        }
    }

    private void writeResult(BacktestResult result) {
        if (properties.outputPath() == null || properties.outputPath().isBlank()) {
            return;
        }
        Path written = resultWriter.write(result, Path.of(properties.outputPath()));
        log.info("[Output] {}", written.toAbsolutePath());
    }

    private void logSection(String title) {
        log.info("========== {} ==========", title);
    }

    private String formatPercent(double value) {
        if (!Double.isFinite(value)) {
            return "NaN";
        }
        return String.format(Locale.US, "%.2f%%", value * 100.0);
    }
}
