package org.nowstart.finpack.strategy.core;

import static org.assertj.core.api.Assertions.assertThat;
import static org.nowstart.finpack.support.MarketDataFixture.day;

import org.junit.jupiter.api.Test;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.support.MarketDataFixture;

class MarketDataViewTest {

    @Test
    void dates_areSortedAndDistinct() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(4), day(2), day(3), day(2))
                .view(MarketScope.GLOBAL);

        assertThat(view.dates()).containsExactly(day(2), day(3), day(4));
    }

    @Test
    void universe_appliesScopeAndExcludedSectors() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .ticker("AAPL", Country.US, "Technology", 100.0)
                .ticker("SPY", Country.US, "Index", 400.0)
                .ticker("2330", Country.TW, "Semiconductors", 500.0)
                .view(MarketScope.US);

        assertThat(view.universe()).containsExactly("AAPL");
    }

    @Test
    void priceOn_carriesLastKnownCloseAndIgnoresInvalidValues() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .price("AAPL", day(2), 100.0)
                .price("AAPL", day(3), Double.NaN)
                .price("AAPL", day(4), -1.0)
                .ticker("MSFT", Country.US, "Technology", 50.0)
                .view(MarketScope.US);

        assertThat(view.priceOn("AAPL", day(4))).isEqualTo(100.0);
        assertThat(view.priceOn("AAPL", day(1))).isNull();
        assertThat(view.priceOn("NONE", day(4))).isNull();
        assertThat(view.pricesOn(day(3))).containsEntry("AAPL", 100.0).containsEntry("MSFT", 50.0);
    }

    @Test
    void exchangeRate_fallsBackToPriorDateThenDefault() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .exchangeRate(day(3), 31.5)
                .view(MarketScope.US);

        assertThat(view.exchangeRate(day(2))).isEqualTo(32.0);
        assertThat(view.exchangeRate(day(3))).isEqualTo(31.5);
        assertThat(view.exchangeRate(day(4))).isEqualTo(31.5);
    }

    @Test
    void topRanked_unionsCountriesInScope() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .sharpeRank(day(2), Country.US, "AAPL", "MSFT", "NVDA")
                .sharpeRank(day(2), Country.TW, "2330", "2317")
                .view(MarketScope.GLOBAL);

        assertThat(view.topRanked(RankingMetric.SHARPE, day(2), 2)).containsExactly("AAPL", "MSFT", "2330", "2317");
        assertThat(view.topRanked(RankingMetric.SHARPE, day(3), 2)).isEmpty();
        assertThat(view.ranking(RankingMetric.GROWTH, day(2), Country.US)).isEmpty();
    }

    @Test
    void topPercentile_roundsCountUp() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .growthRank(day(2), Country.US, "A", "B", "C", "D", "E", "F", "G")
                .view(MarketScope.US);

        assertThat(view.topPercentile(RankingMetric.GROWTH, day(2), 30.0)).containsExactly("A", "B", "C");
    }

    @Test
    void rankingDatesUpTo_includesWarmUpDates() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(3))
                .sharpeRank(day(1), Country.US, "A")
                .sharpeRank(day(2), Country.US, "A")
                .sharpeRank(day(4), Country.US, "A")
                .view(MarketScope.US);

        assertThat(view.rankingDatesUpTo(RankingMetric.SHARPE, day(3))).containsExactly(day(1), day(2));
    }
}
