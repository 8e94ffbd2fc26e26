package org.nowstart.finpack.strategy.buy;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.nowstart.finpack.support.MarketDataFixture.context;
import static org.nowstart.finpack.support.MarketDataFixture.day;

import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.strategy.core.MarketDataView;
import org.nowstart.finpack.support.MarketDataFixture;

class BuyConditionsTest {

    private static final List<String> UNIVERSE = List.of("A", "B", "C", "D", "E");

    @Test
    void sharpeRank_keepsTopNInInputOrder() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .sharpeRank(day(2), Country.US, "C", "A", "E", "B")
                .view(MarketScope.US);

        List<String> result = new SharpeRankCondition().filter(UNIVERSE, context(view, day(2)), new SharpeRankCondition.Params(2));

        assertThat(result).containsExactly("A", "C");
    }

    @Test
    void sharpeThreshold_excludesMissingAndLowValues() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .sharpeValue(day(2), "A", 1.5)
                .sharpeValue(day(2), "B", 1.0)
                .sharpeValue(day(2), "C", 0.9)
                .view(MarketScope.US);

        List<String> result = new SharpeThresholdCondition().filter(UNIVERSE, context(view, day(2)), new SharpeThresholdCondition.Params(1.0));

        assertThat(result).containsExactly("A", "B");
    }

    @Test
    void sharpeStreak_requiresTopNOnEveryRecentDate() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .sharpeRank(day(2), Country.US, "E", "D")
                .sharpeRank(day(3), Country.US, "A", "B", "C")
                .sharpeRank(day(4), Country.US, "B", "A", "D")
                .view(MarketScope.US);

        List<String> result = new SharpeStreakCondition().filter(UNIVERSE, context(view, day(4)), new SharpeStreakCondition.Params(2, 2));

        assertThat(result).containsExactly("A", "B");
    }

    @Test
    void sharpeStreak_returnsNothingWithShortHistory() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3))
                .sharpeRank(day(2), Country.US, "A", "B")
                .sharpeRank(day(3), Country.US, "A", "B")
                .view(MarketScope.US);

        List<String> result = new SharpeStreakCondition().filter(UNIVERSE, context(view, day(3)), new SharpeStreakCondition.Params(3, 5));

        assertThat(result).isEmpty();
    }

    @Test
    void growthRank_keepsTopN() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .growthRank(day(2), Country.US, "D", "B", "A")
                .view(MarketScope.US);

        List<String> result = new GrowthRankCondition().filter(List.of("A", "B", "C"), context(view, day(2)), new GrowthRankCondition.Params(2));

        assertThat(result).containsExactly("B");
    }

    @Test
    void growthStreak_requiresTopPercentileOnEachDate() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3))
                .growthRank(day(2), Country.US, "A", "B", "C", "D")
                .growthRank(day(3), Country.US, "B", "C", "A", "D")
                .view(MarketScope.US);

        List<String> result = new GrowthStreakCondition().filter(UNIVERSE, context(view, day(3)), new GrowthStreakCondition.Params(2, 50.0));

        assertThat(result).containsExactly("B");
    }

    @Test
    void sortSharpe_ordersByValueAndDropsUnvalued() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .sharpeValue(day(2), "A", 0.5)
                .sharpeValue(day(2), "B", 2.0)
                .sharpeValue(day(2), "C", 1.0)
                .view(MarketScope.US);

        List<String> result = new SortSharpeCondition().filter(UNIVERSE, context(view, day(2)), new SortSharpeCondition.Params(2));

        assertThat(result).containsExactly("B", "C");
    }

    @Test
    void sortIndustry_roundRobinsAcrossIndustriesWithCap() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .ticker("T1", Country.US, "Technology", 10.0)
                .ticker("T2", Country.US, "Technology", 10.0)
                .ticker("T3", Country.US, "Technology", 10.0)
                .ticker("H1", Country.US, "Health", 10.0)
                .ticker("X1", Country.US, "", 10.0)
                .sharpeValue(day(2), "T1", 3.0)
                .sharpeValue(day(2), "T2", 2.5)
                .sharpeValue(day(2), "T3", 2.4)
                .sharpeValue(day(2), "H1", 2.0)
                .sharpeValue(day(2), "X1", 1.0)
                .view(MarketScope.US);

        List<String> result = new SortIndustryCondition().filter(
                List.of("T3", "T2", "T1", "H1", "X1"),
                context(view, day(2)),
                new SortIndustryCondition.Params(5, 2)
        );

        assertThat(result).containsExactly("T1", "H1", "X1", "T2");
    }

    @Test
    void params_rejectOutOfRangeValues() {
        assertThatThrownBy(() -> new SharpeRankCondition.Params(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new GrowthStreakCondition.Params(2, 0.0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new SortIndustryCondition.Params(5, 0)).isInstanceOf(IllegalArgumentException.class);
    }
}
