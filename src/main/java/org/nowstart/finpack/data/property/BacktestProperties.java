package org.nowstart.finpack.data.property;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.nowstart.finpack.data.type.MarketScope;
import org.nowstart.finpack.data.type.RebalanceFrequency;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "finpack.backtest")
public record BacktestProperties(
        // run the backtest on startup
        @DefaultValue("false") boolean enabled,
        // market data bundle (JSON) produced by the ranking service
        @NotBlank @DefaultValue("data/market-data.json") String inputPath,
        // result export (JSON); blank skips the export
        @DefaultValue("outputs/backtest-result.json") String outputPath,
        // starting cash in TWD
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("1000000") double initialCapital,
        // budget per new position in TWD
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("100000") double amountPerStock,
        // concurrent position ceiling
        @Min(1) @Max(100) @DefaultValue("10") int maxPositions,
        // global, us or tw
        @NotNull @DefaultValue("us") MarketScope market,
        // first simulated day (snapped forward to a trading day)
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate startDate,
        // last simulated day (snapped back to a trading day)
        @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate endDate,
        // daily, weekly or monthly
        @NotNull @DefaultValue("daily") RebalanceFrequency rebalanceFrequency,
        @Valid @DefaultValue Fees fees,
        // TW share multiple
        @Positive @DefaultValue("1000") int twLotSize,
        // allow fractional US share counts
        @DefaultValue("false") boolean fractionalShares,
        // shrink unaffordable buys to the available cash
        @DefaultValue("true") boolean allowPartialFill,
        // USD/TWD rate when the bundle has none
        @DecimalMin(value = "0", inclusive = false) @DefaultValue("32.0") double defaultExchangeRate,
        // annual risk-free rate for Sharpe and Sortino
        @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.02") double riskFreeRate,
        // industries that are never tradable
        @NotNull @DefaultValue({"Market Index", "Index"}) Set<String> excludedSectors,
        // simulated days between progress log lines
        @Positive @DefaultValue("20") int progressLogInterval,
        @Valid List<RuleProperties> buyConditions,
        @Valid List<RuleProperties> sellConditions,
        @Valid RuleProperties rebalance
) {

    public record Fees(
            @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.003") double usRate,
            // TWD
            @DecimalMin("0") @DefaultValue("15") double usMinFee,
            @DecimalMin("0") @DecimalMax("1") @DefaultValue("0.006") double twRate,
            @DecimalMin("0") @DefaultValue("0") double twMinFee
    ) {
    }

    public record RuleProperties(
            @NotBlank String id,
            @DefaultValue("true") boolean enabled,
            Map<String, Object> params
    ) {
    }
}
