package org.nowstart.finpack.strategy.buy;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.nowstart.finpack.data.type.ConditionCategory;
import org.nowstart.finpack.data.type.RankingMetric;
import org.nowstart.finpack.strategy.core.BuyCondition;
import org.nowstart.finpack.strategy.core.EvaluationContext;
import org.nowstart.finpack.strategy.core.RuleParams;
import org.springframework.stereotype.Component;

/**
 * Picks up to {@code selectN} candidates spread across industries.
 *
 * <p>Industries are visited in order of their best Sharpe value; each round takes the next best
 * name of every industry, and no industry contributes more than {@code perIndustry} names.
 * A missing Sharpe value counts as 0.
 */
@Component
public class SortIndustryCondition implements BuyCondition<SortIndustryCondition.Params> {

    public static final String ID = "sort_industry";
    static final String UNCLASSIFIED = "Unclassified";

    public record Params(int selectN, int perIndustry) implements RuleParams {
        public Params {
            if (selectN <= 0) {
                throw new IllegalArgumentException("selectN must be > 0");
            }
            if (perIndustry <= 0) {
                throw new IllegalArgumentException("perIndustry must be > 0");
            }
        }
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public ConditionCategory category() {
        return ConditionCategory.C;
    }

    @Override
    public Class<Params> parameterType() {
        return Params.class;
    }

    @Override
    public Params defaultParams() {
        return new Params(5, 2);
    }

    @Override
    public List<String> filter(List<String> tickers, EvaluationContext context, Params params) {
        if (tickers.isEmpty()) {
            return List.of();
        }
        Map<String, Double> values = context.data().values(RankingMetric.SHARPE, context.date());
        Comparator<String> bySharpe = Comparator.comparingDouble((String ticker) -> sharpe(values, ticker)).reversed();

        Map<String, List<String>> groups = new LinkedHashMap<>();
        for (String ticker : tickers) {
            if (!context.data().stockInfo().containsKey(ticker)) {
                continue;
            }
            String industry = context.data().industry(ticker);
            groups.computeIfAbsent(industry.isBlank() ? UNCLASSIFIED : industry, key -> new ArrayList<>()).add(ticker);
        }
        groups.values().forEach(group -> group.sort(bySharpe));

        List<List<String>> industries = new ArrayList<>(groups.values());
        industries.sort(Comparator.comparingDouble((List<String> group) -> sharpe(values, group.get(0))).reversed());

        List<String> selected = new ArrayList<>();
        for (int round = 0; round < params.perIndustry() && selected.size() < params.selectN(); round++) {
            for (List<String> group : industries) {
                if (selected.size() >= params.selectN()) {
                    break;
                }
                if (round < group.size()) {
                    selected.add(group.get(round));
                }
            }
        }
        return List.copyOf(selected);
    }

    private static double sharpe(Map<String, Double> values, String ticker) {
        Double value = values.get(ticker);
        return value == null ? 0.0 : value;
    }
}
