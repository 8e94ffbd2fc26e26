package org.nowstart.finpack.data.dto;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import lombok.Builder;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.data.type.RebalanceFrequency;
import org.nowstart.finpack.ledger.FeeSchedule;
import org.nowstart.finpack.ledger.TradingOptions;
import org.nowstart.finpack.service.BacktestProgressListener;

@Builder(toBuilder = true)
public record BacktestRequest(
        double initialCapital,
        double amountPerStock,
        int maxPositions,
        MarketScope market,
        FeeSchedule fees,
        TradingOptions tradingOptions,
        RebalanceFrequency rebalanceFrequency,
        List<RuleConfig> buyConditions,
        List<RuleConfig> sellConditions,
        RuleConfig rebalance,
        LocalDate startDate,
        LocalDate endDate,
        double riskFreeRate,
        Set<String> excludedSectors,
        BacktestProgressListener progressListener
) {
    public static final Set<String> DEFAULT_EXCLUDED_SECTORS = Set.of("Market Index", "Index");

    public BacktestRequest {
        market = market != null ? market : MarketScope.US;
        fees = fees != null ? fees : FeeSchedule.defaults();
        tradingOptions = tradingOptions != null ? tradingOptions : TradingOptions.defaults();
        rebalanceFrequency = rebalanceFrequency != null ? rebalanceFrequency : RebalanceFrequency.DAILY;
        buyConditions = buyConditions != null ? List.copyOf(buyConditions) : List.of();
        sellConditions = sellConditions != null ? List.copyOf(sellConditions) : List.of();
        rebalance = rebalance != null ? rebalance : RuleConfig.enabled("immediate");
        excludedSectors = excludedSectors != null ? Set.copyOf(excludedSectors) : DEFAULT_EXCLUDED_SECTORS;
    }
}
