package org.nowstart.finpack.strategy.sell;

import static org.assertj.core.api.Assertions.assertThat;
import static org.nowstart.finpack.support.MarketDataFixture.context;
import static org.nowstart.finpack.support.MarketDataFixture.day;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.nowstart.finpack.data.dto.SellDecision;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.ledger.FeeSchedule;
import org.nowstart.finpack.ledger.Portfolio;
import org.nowstart.finpack.ledger.Position;
import org.nowstart.finpack.strategy.core.MarketDataView;
import org.nowstart.finpack.strategy.core.SelectionHistory;
import org.nowstart.finpack.support.MarketDataFixture;

class SellConditionsTest {

    @Test
    void sharpeFail_sellsOnlyAfterConsecutiveFailures() {
        assertThat(sharpeFailDecisions(2)).containsExactly(false, true, false, false, true, true);
    }

    @Test
    void sharpeFail_passResetsStreakBeforeThirdFailure() {
        assertThat(sharpeFailDecisions(3)).containsExactly(false, false, false, false, false, true);
    }

    @Test
    void sharpeFail_keepsStreakOnDayWithoutRanking() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .sharpeRank(day(2), Country.US, "MSFT")
                .sharpeRank(day(4), Country.US, "MSFT")
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        SharpeFailCondition condition = new SharpeFailCondition();
        SharpeFailCondition.Params params = new SharpeFailCondition.Params(2, 1);

        condition.check(position, context(view, day(2)), params);
        SellDecision gap = condition.check(position, context(view, day(3)), params);
        SellDecision next = condition.check(position, context(view, day(4)), params);

        assertThat(gap.shouldSell()).isFalse();
        assertThat(next.shouldSell()).isTrue();
        assertThat(position.getConsecutiveRankFailures()).isEqualTo(2);
    }

    @Test
    void sharpeFail_usesTickersOwnCountryRanking() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .sharpeRank(day(2), Country.US, "AAPL")
                .sharpeRank(day(2), Country.TW, "2330")
                .view(MarketScope.GLOBAL);
        Position position = openPosition("2330", Country.TW, 500.0);

        SellDecision decision = new SharpeFailCondition().check(position, context(view, day(2)), new SharpeFailCondition.Params(1, 1));

        assertThat(decision.shouldSell()).isFalse();
    }

    @Test
    void weakness_requiresBothMetricsWeakForConsecutiveDays() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .sharpeRank(day(2), Country.US, "X", "Y", "AAPL")
                .growthRank(day(2), Country.US, "X", "Y")
                .sharpeRank(day(3), Country.US, "AAPL")
                .growthRank(day(3), Country.US, "X", "Y")
                .sharpeRank(day(4), Country.US, "X", "Y")
                .growthRank(day(4), Country.US, "X", "Y", "Z", "AAPL")
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        WeaknessCondition condition = new WeaknessCondition();
        WeaknessCondition.Params params = new WeaknessCondition.Params(2, 1);

        assertThat(condition.check(position, context(view, day(2)), params).shouldSell()).isTrue();
        assertThat(condition.check(position, context(view, day(3)), params).shouldSell()).isFalse();
        assertThat(condition.check(position, context(view, day(4)), params).shouldSell()).isTrue();
    }

    @Test
    void weakness_keepsTickerRankedExactlyAtK() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3))
                .sharpeRank(day(2), Country.US, "X", "AAPL", "Y")
                .growthRank(day(2), Country.US, "X", "AAPL", "Y")
                .sharpeRank(day(3), Country.US, "X", "Y", "AAPL")
                .growthRank(day(3), Country.US, "X", "Y", "AAPL")
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        WeaknessCondition condition = new WeaknessCondition();
        WeaknessCondition.Params params = new WeaknessCondition.Params(2, 1);

        assertThat(condition.check(position, context(view, day(2)), params).shouldSell()).isFalse();
        assertThat(condition.check(position, context(view, day(3)), params).shouldSell()).isTrue();
    }

    @Test
    void growthFail_sellsWhenRecentAverageDropsBelowThreshold() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3), day(4))
                .growthValue(day(2), "AAPL", 0.5)
                .growthValue(day(3), "AAPL", -0.2)
                .growthValue(day(3), "MSFT", 1.0)
                .growthValue(day(4), "AAPL", -0.4)
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        GrowthFailCondition condition = new GrowthFailCondition();

        assertThat(condition.check(position, context(view, day(3)), new GrowthFailCondition.Params(2, 0.0)).shouldSell()).isFalse();
        assertThat(condition.check(position, context(view, day(4)), new GrowthFailCondition.Params(2, 0.0)).shouldSell()).isTrue();
        assertThat(condition.check(position, context(view, day(4)), new GrowthFailCondition.Params(5, 0.0)).shouldSell()).isFalse();
    }

    @Test
    void notSelected_sellsAfterMissingFromRecentSelections() {
        MarketDataView view = new MarketDataFixture().tradingDays(day(2), day(3), day(4), day(5)).view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        NotSelectedCondition condition = new NotSelectedCondition();
        NotSelectedCondition.Params params = new NotSelectedCondition.Params(2);
        SelectionHistory history = new SelectionHistory();
        history.append(day(2), List.of("AAPL"));

        assertThat(condition.check(position, context(view, day(3), history), params).shouldSell()).isFalse();

        history.append(day(3), List.of("MSFT"));
        assertThat(condition.check(position, context(view, day(4), history), params).shouldSell()).isFalse();

        history.append(day(4), List.of());
        assertThat(condition.check(position, context(view, day(5), history), params).shouldSell()).isTrue();
    }

    @Test
    void drawdown_measuresFromAverageCost() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2), day(3))
                .price("AAPL", day(2), 70.0)
                .price("AAPL", day(3), 60.0)
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        DrawdownCondition.Params params = new DrawdownCondition.Params(0.40, false);

        assertThat(new DrawdownCondition().check(position, context(view, day(2)), params).shouldSell()).isFalse();
        SellDecision decision = new DrawdownCondition().check(position, context(view, day(3)), params);
        assertThat(decision.shouldSell()).isTrue();
        assertThat(decision.reason()).contains("40.0%");
    }

    @Test
    void drawdown_measuresFromHighestWhenConfigured() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .price("AAPL", day(2), 140.0)
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        position.observePrice(200.0);

        assertThat(new DrawdownCondition().check(position, context(view, day(2)), new DrawdownCondition.Params(0.25, true)).shouldSell()).isTrue();
        assertThat(new DrawdownCondition().check(position, context(view, day(2)), new DrawdownCondition.Params(0.25, false)).shouldSell()).isFalse();
    }

    @Test
    void sellConditionSet_evaluatesEveryConditionAndJoinsReasons() {
        MarketDataView view = new MarketDataFixture()
                .tradingDays(day(2))
                .price("AAPL", day(2), 50.0)
                .sharpeRank(day(2), Country.US, "MSFT")
                .view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        SellConditionSet set = new SellConditionSet(List.of(
                new ConfiguredSellCondition<>(new DrawdownCondition(), new DrawdownCondition.Params(0.40, false)),
                new ConfiguredSellCondition<>(new SharpeFailCondition(), new SharpeFailCondition.Params(3, 1))
        ));

        SellDecision decision = set.evaluate(position, context(view, day(2)));

        assertThat(decision.shouldSell()).isTrue();
        assertThat(decision.reason()).startsWith("drawdown");
        assertThat(position.getConsecutiveRankFailures()).isEqualTo(1);
    }

    private static Position openPosition(String ticker, Country country, double price) {
        Portfolio portfolio = new Portfolio(10_000_000, FeeSchedule.defaults());
        portfolio.buy(ticker, 1000, price, country, day(1), 30.0);
        return portfolio.findPosition(ticker).orElseThrow();
    }

    private static List<Boolean> sharpeFailDecisions(int periods) {
        List<LocalDate> dates = List.of(day(2), day(3), day(4), day(5), day(8), day(9));
        boolean[] inTop = {false, false, true, false, false, false};
        MarketDataFixture fixture = new MarketDataFixture().tradingDays(dates.toArray(new LocalDate[0]));
        for (int i = 0; i < dates.size(); i++) {
            if (inTop[i]) {
                fixture.sharpeRank(dates.get(i), Country.US, "AAPL", "MSFT");
            } else {
                fixture.sharpeRank(dates.get(i), Country.US, "MSFT", "AAPL");
            }
        }
        MarketDataView view = fixture.view(MarketScope.US);
        Position position = openPosition("AAPL", Country.US, 100.0);
        SharpeFailCondition condition = new SharpeFailCondition();

        List<Boolean> sells = new ArrayList<>();
        for (LocalDate date : dates) {
            sells.add(condition.check(position, context(view, date), new SharpeFailCondition.Params(periods, 1)).shouldSell());
        }
        return sells;
    }
}
