package org.nowstart.finpack.service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.NavigableMap;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.finpack.data.dto.BenchmarkPoint;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.strategy.core.MarketDataView;
import org.springframework.stereotype.Service;

/**
 * Buy-and-hold curve of the market index, in the ledger currency, on the simulated dates.
 *
 * <p>The US leg converts the capital to USD at the first day's rate and back at each day's rate.
 * A global scope holds half of the capital in each index. Dates on which an index has no close
 * are left out.
 */
@Slf4j
@Service
public class BenchmarkService {

    public List<BenchmarkPoint> curve(MarketDataView data, List<LocalDate> tradingDates, double initialCapital) {
        MarketScope scope = data.scope();
        List<NavigableMap<LocalDate, Double>> series = new ArrayList<>();
        for (Country country : scope.countries()) {
            NavigableMap<LocalDate, Double> index = data.benchmark(country);
            if (index.isEmpty()) {
                log.warn("event=benchmark_missing market={} country={}", scope, country);
                return List.of();
            }
            series.add(index);
        }

        double weight = 1.0 / series.size();
        double[] firstPrice = new double[series.size()];
        double firstRate = Double.NaN;
        List<BenchmarkPoint> curve = new ArrayList<>();
        for (LocalDate date : tradingDates) {
            double[] prices = new double[series.size()];
            boolean complete = true;
            for (int i = 0; i < series.size(); i++) {
                Double price = series.get(i).get(date);
                if (price == null) {
                    complete = false;
                    break;
                }
                prices[i] = price;
            }
            if (!complete) {
                continue;
            }

            double rate = data.exchangeRate(date);
            if (curve.isEmpty()) {
                System.arraycopy(prices, 0, firstPrice, 0, prices.length);
                firstRate = rate;
            }

            double equity = 0.0;
            for (int i = 0; i < series.size(); i++) {
                Country country = scope.countries().get(i);
                double fxFactor = country.foreignCurrency() ? rate / firstRate : 1.0;
                equity += weight * initialCapital * (prices[i] / firstPrice[i]) * fxFactor;
            }
            curve.add(new BenchmarkPoint(date, equity));
        }

        log.info("event=benchmark_computed market={} points={}", scope, curve.size());
        return List.copyOf(curve);
    }
}
