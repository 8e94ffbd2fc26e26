package org.nowstart.finpack.strategy.rebalance;

import java.util.ArrayList;
import java.util.List;
import org.nowstart.finpack.data.dto.RebalanceResult;
import org.nowstart.finpack.data.dto.TickerInfo;
import org.nowstart.finpack.data.dto.TradeResult;
import org.nowstart.finpack.ledger.TradeExecutor;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RebalanceContext;
import org.nowstart.finpack.strategy.core.RebalanceStrategy;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Scales in: each cycle spends {@code batchRatio} of the available cash, split evenly over the
 * targets not yet held. Never sells, and never tops up free slots outside that budget.
 */
@Component
public class BatchRebalance implements RebalanceStrategy<BatchRebalance.Params> {

    public static final String ID = "batch";

    public record Params(double batchRatio) implements RuleParams {
        public Params {
            if (!(batchRatio > 0.0) || batchRatio > 1.0) {
                throw new IllegalArgumentException("batchRatio must be in (0, 1]");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(0.20);
    }

    @Override
    public boolean shouldRebalance(RebalanceContext context, Params params) {
        return true;
    }

    @Override
    public boolean fillsOpenSlots() {
        return false;
    }

    @Override
    public RebalanceResult execute(TradeExecutor executor, List<String> targets, EvaluationContext context, Params params) {
        List<String> toBuy = targets.stream()
                .filter(ticker -> !executor.portfolio().hasPosition(ticker))
                .toList();
        if (toBuy.isEmpty()) {
            return RebalanceResult.empty();
        }

        double budget = executor.portfolio().cash() * params.batchRatio() / toBuy.size();
        List<TradeResult> buys = new ArrayList<>();
        for (String ticker : toBuy) {
            Double price = context.price(ticker);
            TickerInfo info = context.data().stockInfo().get(ticker);
            if (price != null && info != null) {
                buys.add(executor.executeBuy(ticker, price, info.country(), context.date(), budget, context.exchangeRate()));
            }
        }
        return new RebalanceResult(List.of(), List.copyOf(buys));
    }
}
