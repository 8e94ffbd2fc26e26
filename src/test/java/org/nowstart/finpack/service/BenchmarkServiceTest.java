package org.nowstart.finpack.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;
import static org.nowstart.finpack.support.MarketDataFixture.day;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.finpack.data.dto.BenchmarkPoint;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.strategy.core.MarketDataView;
import org.nowstart.finpack.support.MarketDataFixture;

class BenchmarkServiceTest {

    private final BenchmarkService service = new BenchmarkService();

    @Test
    void curve_convertsUsIndexThroughExchangeRate() {
        MarketDataView view = fixture().view(MarketScope.US);

        List<BenchmarkPoint> curve = service.curve(view, List.of(day(2), day(3)), 1_000_000);

        assertThat(curve).extracting(BenchmarkPoint::date).containsExactly(day(2), day(3));
        assertThat(curve.get(0).equity()).isCloseTo(1_000_000, within(1e-6));
        assertThat(curve.get(1).equity()).isCloseTo(1_210_000, within(1e-6));
    }

    @Test
    void curve_splitsCapitalEquallyForGlobalScope() {
        MarketDataView view = fixture().view(MarketScope.GLOBAL);

        List<BenchmarkPoint> curve = service.curve(view, List.of(day(2), day(3)), 1_000_000);

        assertThat(curve.get(1).equity()).isCloseTo(500_000 * 1.21 + 500_000 * 0.9, within(1e-6));
    }

    @Test
    void curve_skipsDatesWithoutIndexClose() {
        MarketDataView view = fixture().view(MarketScope.TW);

        List<BenchmarkPoint> curve = service.curve(view, List.of(day(2), day(3), day(4)), 1_000_000);

        assertThat(curve).extracting(BenchmarkPoint::date).containsExactly(day(2), day(3));
    }

    @Test
    void curve_isEmptyWhenIndexMissing() {
        MarketDataView view = new MarketDataFixture().tradingDays(day(2)).view(MarketScope.US);

        assertThat(service.curve(view, List.of(day(2)), 1_000_000)).isEmpty();
    }

    private static MarketDataFixture fixture() {
        return new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .exchangeRate(day(2), 30.0)
                .exchangeRate(day(3), 33.0)
                .benchmark(Country.US, day(2), 100.0)
                .benchmark(Country.US, day(3), 110.0)
                .benchmark(Country.US, day(4), 110.0)
                .benchmark(Country.TW, day(2), 100.0)
                .benchmark(Country.TW, day(3), 90.0);
    }
}
