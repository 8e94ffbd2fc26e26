package org.nowstart.finpack.data.type;

import com.fasterxml.jackson.annotation.JsonCreator;
import java.util.List;
import java.util.Locale;

public enum MarketScope {
    GLOBAL(List.of(Country.US, Country.TW)),
    US(List.of(Country.US)),
    TW(List.of(Country.TW));

    private final List<Country> countries;

    MarketScope(List<Country> countries) {
        this.countries = countries;
    }

    public List<Country> countries() {
        return countries;
    }

    public boolean includes(Country country) {
        return countries.contains(country);
    }

    @JsonCreator
    public static MarketScope from(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("market is required");
        }
        return MarketScope.valueOf(raw.trim().toUpperCase(Locale.ROOT));
    }
}
