package org.nowstart.finpack.service;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.Map;
import org.junit.jupiter.api.Test;
import org.nowstart.finpack.data.dto.BacktestRequest;
import org.nowstart.finpack.data.dto.RuleConfig;
import org.nowstart.finpack.data.property.BacktestProperties;
import org.nowstart.finpack.data.type.Country;
import org.nowstart.finpack.support.BacktestPropertiesFixture;

class BacktestRequestFactoryTest {

    private final BacktestRequestFactory factory = new BacktestRequestFactory();

    @Test
    void create_mapsPropertiesToRequest() {
        BacktestProperties properties = BacktestPropertiesFixture.bind(Map.of(
                "finpack.backtest.max-positions", "4",
                "finpack.backtest.fees.us-rate", "0.001",
                "finpack.backtest.tw-lot-size", "1",
                "finpack.backtest.buy-conditions[0].id", "sharpe_rank",
                "finpack.backtest.sell-conditions[0].id", "drawdown",
                "finpack.backtest.rebalance.id", "batch"
        ));
        BacktestProgressListener listener = progress -> { };

        BacktestRequest request = factory.create(properties, listener);

        assertThat(request.maxPositions()).isEqualTo(4);
        assertThat(request.fees().rule(Country.US).rate()).isEqualTo(0.001);
        assertThat(request.fees().rule(Country.US).minFee()).isEqualTo(15.0);
        assertThat(request.tradingOptions().twLotSize()).isEqualTo(1);
        assertThat(request.buyConditions()).extracting(RuleConfig::id).containsExactly("sharpe_rank");
        assertThat(request.sellConditions()).extracting(RuleConfig::id).containsExactly("drawdown");
        assertThat(request.rebalance().id()).isEqualTo("batch");
        assertThat(request.progressListener()).isSameAs(listener);
    }

    @Test
    void create_defaultsRebalanceToImmediateWhenUnset() {
        BacktestRequest request = factory.create(BacktestPropertiesFixture.bind(Map.of()), null);

        assertThat(request.rebalance()).isEqualTo(RuleConfig.enabled("immediate"));
        assertThat(request.buyConditions()).isEmpty();
        assertThat(request.excludedSectors()).containsExactlyInAnyOrder("Market Index", "Index");
    }
}
