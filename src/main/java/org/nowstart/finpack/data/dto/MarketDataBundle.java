package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.RankingMetric;

/**
 * Read-only input produced by the upstream ranking/price service.
 */
public record MarketDataBundle(
        List<LocalDate> dates,
        Map<String, Map<LocalDate, Double>> prices,
        Map<String, TickerInfo> stockInfo,
        Map<LocalDate, Map<Country, List<String>>> sharpeRank,
        Map<LocalDate, Map<Country, List<String>>> growthRank,
        Map<LocalDate, Map<String, Double>> sharpeValues,
        Map<LocalDate, Map<String, Double>> growthValues,
        Map<LocalDate, Double> exchangeRates,
        Map<Country, Map<LocalDate, Double>> benchmarks
) {
    public MarketDataBundle {
        sharpeRank = sharpeRank != null ? sharpeRank : Map.of();
        growthRank = growthRank != null ? growthRank : Map.of();
        sharpeValues = sharpeValues != null ? sharpeValues : Map.of();
        growthValues = growthValues != null ? growthValues : Map.of();
        exchangeRates = exchangeRates != null ? exchangeRates : Map.of();
        benchmarks = benchmarks != null ? benchmarks : Map.of();
    }

    public Map<LocalDate, Map<Country, List<String>>> ranking(RankingMetric metric) {
        return metric == RankingMetric.SHARPE ? sharpeRank : growthRank;
    }

    public Map<LocalDate, Map<String, Double>> values(RankingMetric metric) {
        return metric == RankingMetric.SHARPE ? sharpeValues : growthValues;
    }
}
