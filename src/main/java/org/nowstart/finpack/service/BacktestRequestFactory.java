package org.nowstart.finpack.service;

import java.util.List;
import org.nowstart.finpack.data.dto.BacktestRequest;
import org.nowstart.finpack.data.dto.RuleConfig;
import org.nowstart.finpack.data.property.BacktestProperties;
import org.nowstart.finpack.data.property.BacktestProperties.RuleProperties;
import org.nowstart.finpack.ledger.FeeRule;
import org.nowstart.finpack.ledger.FeeSchedule;
import org.nowstart.finpack.ledger.TradingOptions;
import org.springframework.stereotype.Component;

@Component
public class BacktestRequestFactory {

    public BacktestRequest create(BacktestProperties properties, BacktestProgressListener progressListener) {
        BacktestProperties.Fees fees = properties.fees();
        return BacktestRequest.builder()
                .initialCapital(properties.initialCapital())
                .amountPerStock(properties.amountPerStock())
                .maxPositions(properties.maxPositions())
                .market(properties.market())
                .fees(FeeSchedule.of(
                        new FeeRule(fees.usRate(), fees.usMinFee()),
                        new FeeRule(fees.twRate(), fees.twMinFee())
                ))
                .tradingOptions(new TradingOptions(
                        properties.twLotSize(),
                        properties.fractionalShares(),
                        properties.allowPartialFill(),
                        properties.defaultExchangeRate()
                ))
                .rebalanceFrequency(properties.rebalanceFrequency())
                .buyConditions(toRuleConfigs(properties.buyConditions()))
                .sellConditions(toRuleConfigs(properties.sellConditions()))
                .rebalance(properties.rebalance() == null ? null : toRuleConfig(properties.rebalance()))
                .startDate(properties.startDate())
                .endDate(properties.endDate())
                .riskFreeRate(properties.riskFreeRate())
                .excludedSectors(properties.excludedSectors())
                .progressListener(progressListener)
                .build();
    }

    private List<RuleConfig> toRuleConfigs(List<RuleProperties> rules) {
        if (rules == null) {
            return List.of();
        }
        return rules.stream().map(this::toRuleConfig).toList();
    }

    private RuleConfig toRuleConfig(RuleProperties rule) {
        return new RuleConfig(rule.id(), rule.enabled(), rule.params());
    }
}
