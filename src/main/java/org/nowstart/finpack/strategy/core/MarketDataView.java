package org.nowstart.finpack.strategy.core;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Set;
import java.util.TreeMap;
import org.nowstart.finpack.data.dto.MarketDataBundle;
import org.nowstart.finpack.data.dto.TickerInfo;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.data.type.RankingMetric;

/**
 * Run-scoped read-only view over a {@link MarketDataBundle}.
 *
 * <p>Prices are resolved to the last known value on or before the requested date, so a ticker
 * with a gap keeps its previous close. That may be imprecise for illiquid names.
 */
public final class MarketDataView {

    private final List<LocalDate> dates;
    private final Map<String, NavigableMap<LocalDate, Double>> prices;
    private final Map<String, TickerInfo> stockInfo;
    private final Map<RankingMetric, NavigableMap<LocalDate, Map<Country, List<String>>>> rankings;
    private final Map<RankingMetric, NavigableMap<LocalDate, Map<String, Double>>> values;
    private final NavigableMap<LocalDate, Double> exchangeRates;
    private final Map<Country, NavigableMap<LocalDate, Double>> benchmarks;
    private final MarketScope scope;
    private final List<String> universe;
    private final double defaultExchangeRate;

    private MarketDataView(MarketDataBundle bundle, MarketScope scope, Set<String> excludedSectors, double defaultExchangeRate) {
        this.dates = bundle.dates().stream().sorted().distinct().toList();
        this.stockInfo = Collections.unmodifiableMap(new LinkedHashMap<>(bundle.stockInfo()));
        this.scope = scope;
        this.defaultExchangeRate = defaultExchangeRate;

        Map<String, NavigableMap<LocalDate, Double>> priceSeries = new LinkedHashMap<>();
        bundle.prices().forEach((ticker, series) -> priceSeries.put(ticker, finiteSeries(series)));
        this.prices = Collections.unmodifiableMap(priceSeries);

        this.rankings = new EnumMap<>(RankingMetric.class);
        this.values = new EnumMap<>(RankingMetric.class);
        for (RankingMetric metric : RankingMetric.values()) {
            rankings.put(metric, Collections.unmodifiableNavigableMap(new TreeMap<>(bundle.ranking(metric))));
            values.put(metric, Collections.unmodifiableNavigableMap(new TreeMap<>(bundle.values(metric))));
        }

        this.exchangeRates = finiteSeries(bundle.exchangeRates());
        this.benchmarks = new EnumMap<>(Country.class);
        bundle.benchmarks().forEach((country, series) -> benchmarks.put(country, finiteSeries(series)));

        Set<String> excluded = excludedSectors == null ? Set.of() : excludedSectors;
        this.universe = stockInfo.entrySet().stream()
                .filter(entry -> scope.includes(entry.getValue().country()))
                .filter(entry -> !excluded.contains(entry.getValue().industry()))
                .map(Map.Entry::getKey)
                .toList();
    }

    public static MarketDataView of(MarketDataBundle bundle, MarketScope scope, Set<String> excludedSectors, double defaultExchangeRate) {
        return new MarketDataView(bundle, scope, excludedSectors, defaultExchangeRate);
    }

    public List<LocalDate> dates() {
        return dates;
    }

    public MarketScope scope() {
        return scope;
    }

    public Map<String, TickerInfo> stockInfo() {
        return stockInfo;
    }

    public Country country(String ticker) {
        TickerInfo info = stockInfo.get(ticker);
        return info == null ? Country.US : info.country();
    }

    public String industry(String ticker) {
        TickerInfo info = stockInfo.get(ticker);
        return info == null ? "" : info.industry();
    }

    /**
     * Eligible tickers: inside the market scope and not in an excluded sector, in input order.
     */
    public List<String> universe() {
        return universe;
    }

    public Double priceOn(String ticker, LocalDate date) {
        NavigableMap<LocalDate, Double> series = prices.get(ticker);
        if (series == null) {
            return null;
        }
        Map.Entry<LocalDate, Double> entry = series.floorEntry(date);
        return entry == null ? null : entry.getValue();
    }

    public Map<String, Double> pricesOn(LocalDate date) {
        Map<String, Double> resolved = new LinkedHashMap<>();
        for (Map.Entry<String, NavigableMap<LocalDate, Double>> series : prices.entrySet()) {
            Map.Entry<LocalDate, Double> entry = series.getValue().floorEntry(date);
            if (entry != null) {
                resolved.put(series.getKey(), entry.getValue());
            }
        }
        return resolved;
    }

    /**
     * Same-day rate, else the most recent earlier rate, else the configured default.
     */
    public double exchangeRate(LocalDate date) {
        Map.Entry<LocalDate, Double> entry = exchangeRates.floorEntry(date);
        return entry == null ? defaultExchangeRate : entry.getValue();
    }

    public boolean hasRanking(RankingMetric metric, LocalDate date) {
        return rankings.get(metric).containsKey(date);
    }

    public List<String> ranking(RankingMetric metric, LocalDate date, Country country) {
        Map<Country, List<String>> byCountry = rankings.get(metric).get(date);
        if (byCountry == null) {
            return List.of();
        }
        List<String> ranked = byCountry.get(country);
        return ranked == null ? List.of() : ranked;
    }

    /**
     * Union of the per-country top {@code n} for every country in the scope, US first.
     */
    public List<String> topRanked(RankingMetric metric, LocalDate date, int n) {
        Set<String> selected = new LinkedHashSet<>();
        for (Country country : scope.countries()) {
            List<String> ranked = ranking(metric, date, country);
            selected.addAll(ranked.subList(0, Math.min(n, ranked.size())));
        }
        return List.copyOf(selected);
    }

    /**
     * Union of the per-country top {@code percentile}% (rounded up) for every country in the scope.
     */
    public List<String> topPercentile(RankingMetric metric, LocalDate date, double percentile) {
        Set<String> selected = new LinkedHashSet<>();
        for (Country country : scope.countries()) {
            List<String> ranked = ranking(metric, date, country);
            int n = (int) Math.ceil(ranked.size() * percentile / 100.0);
            selected.addAll(ranked.subList(0, Math.min(n, ranked.size())));
        }
        return List.copyOf(selected);
    }

    /**
     * Ranking dates on or before {@code date}, ascending. Includes warm-up dates before the simulated range.
     */
    public List<LocalDate> rankingDatesUpTo(RankingMetric metric, LocalDate date) {
        return new ArrayList<>(rankings.get(metric).headMap(date, true).keySet());
    }

    public List<LocalDate> valueDatesUpTo(RankingMetric metric, LocalDate date) {
        return new ArrayList<>(values.get(metric).headMap(date, true).keySet());
    }

    public Map<String, Double> values(RankingMetric metric, LocalDate date) {
        Map<String, Double> day = values.get(metric).get(date);
        return day == null ? Map.of() : day;
    }

    public Double value(RankingMetric metric, LocalDate date, String ticker) {
        return values(metric, date).get(ticker);
    }

    public NavigableMap<LocalDate, Double> benchmark(Country country) {
        NavigableMap<LocalDate, Double> series = benchmarks.get(country);
        return series == null ? Collections.emptyNavigableMap() : series;
    }

    private static NavigableMap<LocalDate, Double> finiteSeries(Map<LocalDate, Double> raw) {
        TreeMap<LocalDate, Double> series = new TreeMap<>();
        if (raw != null) {
            raw.forEach((date, value) -> {
                if (date != null && value != null && Double.isFinite(value) && value > 0.0) {
                    series.put(date, value);
                }
            });
        }
        return Collections.unmodifiableNavigableMap(series);
    }
}
