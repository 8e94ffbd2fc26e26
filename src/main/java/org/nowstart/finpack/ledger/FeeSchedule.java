package org.nowstart.finpack.ledger;

import java.util.EnumMap;
import java.util.Map;
import org.nowstart.finpack.data.type.Country;

public record FeeSchedule(Map<Country, FeeRule> rules) {

    public static final FeeRule DEFAULT_US = new FeeRule(0.003, 15.0);
    public static final FeeRule DEFAULT_TW = new FeeRule(0.006, 0.0);

    public FeeSchedule {
        Map<Country, FeeRule> resolved = new EnumMap<>(Country.class);
        resolved.put(Country.US, DEFAULT_US);
        resolved.put(Country.TW, DEFAULT_TW);
        if (rules != null) {
            resolved.putAll(rules);
        }
        rules = Map.copyOf(resolved);
    }

    public static FeeSchedule defaults() {
        return new FeeSchedule(Map.of());
    }

    public static FeeSchedule of(FeeRule us, FeeRule tw) {
        return new FeeSchedule(Map.of(Country.US, us, Country.TW, tw));
    }

    public FeeRule rule(Country country) {
        return rules.get(country);
    }

    public double fee(double ledgerAmount, Country country) {
        return rule(country).fee(ledgerAmount);
    }
}
