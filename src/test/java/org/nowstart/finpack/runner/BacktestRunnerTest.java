package org.nowstart.finpack.runner;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.nowstart.finpack.data.dto.BacktestMetrics;
import org.nowstart.finpack.data.dto.BacktestRequest;
import org.nowstart.finpack.data.dto.BacktestResult;
import org.nowstart.finpack.data.dto.MarketDataBundle;
import org.nowstart.finpack.data.exception.BacktestException;
import org.nowstart.finpack.data.property.BacktestProperties;
import org.nowstart.finpack.service.BacktestEngine;
import org.nowstart.finpack.service.BacktestRequestFactory;
import org.nowstart.finpack.service.BacktestResultWriter;
import org.nowstart.finpack.service.MarketDataBundleLoader;
import org.nowstart.finpack.service.PerformanceReportService;
import org.nowstart.finpack.support.BacktestPropertiesFixture;
import org.springframework.boot.DefaultApplicationArguments;

class BacktestRunnerTest {

    private MarketDataBundleLoader bundleLoader;
    private BacktestEngine backtestEngine;
    private PerformanceReportService performanceReportService;
    private BacktestResultWriter resultWriter;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        bundleLoader = mock(MarketDataBundleLoader.class);
        backtestEngine = mock(BacktestEngine.class);
        performanceReportService = mock(PerformanceReportService.class);
        resultWriter = mock(BacktestResultWriter.class);
    }

    @Test
    void run_skipsWhenDisabled() {
        BacktestRunner runner = runner(BacktestPropertiesFixture.bind(Map.of()));

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(bundleLoader, backtestEngine, resultWriter);
    }

    @Test
    void run_simulatesAndWritesResult() {
        Path output = tempDir.resolve("result.json");
        BacktestRunner runner = runner(enabled(output));
        MarketDataBundle bundle = new MarketDataBundle(List.of(), Map.of(), Map.of(), null, null, null, null, null, null);
        BacktestResult result = BacktestResult.success(mock(BacktestMetrics.class), List.of(), List.of(), Map.of(), Map.of(), null, List.of());
        when(bundleLoader.load(Path.of("market.json"))).thenReturn(bundle);
        when(backtestEngine.run(eq(bundle), any(BacktestRequest.class))).thenReturn(result);
        when(backtestEngine.describe(any(BacktestRequest.class))).thenReturn(List.of());
        when(performanceReportService.formatSummary(any())).thenReturn("summary");
        when(resultWriter.write(result, output)).thenReturn(output);

        runner.run(new DefaultApplicationArguments());

        verify(backtestEngine).run(eq(bundle), any(BacktestRequest.class));
        verify(performanceReportService).formatSummary(result.metrics());
        verify(resultWriter).write(result, output);
    }

    @Test
    void run_stopsWhenBundleCannotBeLoaded() {
        BacktestRunner runner = runner(enabled(tempDir.resolve("result.json")));
        when(bundleLoader.load(any())).thenThrow(new BacktestException(BacktestException.INVALID_BUNDLE, "missing"));

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(backtestEngine, resultWriter);
    }

    @Test
    void run_writesFailedResultWithoutSummary() {
        Path output = tempDir.resolve("result.json");
        BacktestRunner runner = runner(enabled(output));
        BacktestResult failure = BacktestResult.failure(BacktestException.NO_TRADING_DAYS, "empty range");
        when(bundleLoader.load(any())).thenReturn(mock(MarketDataBundle.class));
        when(backtestEngine.run(any(), any())).thenReturn(failure);
        when(resultWriter.write(failure, output)).thenReturn(output);

        runner.run(new DefaultApplicationArguments());

        verify(resultWriter).write(failure, output);
        verify(performanceReportService, never()).formatSummary(any());
        verify(backtestEngine, never()).describe(any());
    }

    private BacktestRunner runner(BacktestProperties properties) {
        return new BacktestRunner(
                properties,
                bundleLoader,
                new BacktestRequestFactory(),
                backtestEngine,
                performanceReportService,
                resultWriter
        );
    }

    private static BacktestProperties enabled(Path output) {
        return BacktestPropertiesFixture.bind(Map.of(
                "finpack.backtest.enabled", "true",
                "finpack.backtest.input-path", "market.json",
                "finpack.backtest.output-path", output.toString(),
                "finpack.backtest.buy-conditions[0].id", "sharpe_rank"
        ));
    }
}
