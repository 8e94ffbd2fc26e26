package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one engine run. On failure only {@code errorCode}, {@code error} and, when
 * the date range was resolved, {@code dateAdjustment} are populated.
 */
public record BacktestResult(
        boolean success,
        String errorCode,
        String error,
        BacktestMetrics metrics,
        List<EquitySnapshot> equityCurve,
        List<TradeRecord> trades,
        Map<String, FinalPosition> finalPositions,
        Map<LocalDate, List<String>> selectionHistory,
        DateAdjustment dateAdjustment,
        List<BenchmarkPoint> benchmarkCurve
) {
    public static BacktestResult success(
            BacktestMetrics metrics,
            List<EquitySnapshot> equityCurve,
            List<TradeRecord> trades,
            Map<String, FinalPosition> finalPositions,
            Map<LocalDate, List<String>> selectionHistory,
            DateAdjustment dateAdjustment,
            List<BenchmarkPoint> benchmarkCurve
    ) {
        return new BacktestResult(
                true,
                null,
                null,
                metrics,
                equityCurve,
                trades,
                finalPositions,
                selectionHistory,
                dateAdjustment,
                benchmarkCurve
        );
    }

    public static BacktestResult failure(String errorCode, String error) {
        return failure(errorCode, error, null);
    }

    public static BacktestResult failure(String errorCode, String error, DateAdjustment dateAdjustment) {
        return new BacktestResult(
                false,
                errorCode,
                error,
                null,
                List.of(),
                List.of(),
                Map.of(),
                Map.of(),
                dateAdjustment,
                List.of()
        );
    }
}
