package org.nowstart.finpack.data.dto;

import com.fasterxml.jackson.annotation.JsonAlias;
import org.nowstart.finpack.data.type.Country;

public record TickerInfo(
        Country country,
        @JsonAlias("sector") String industry
) {
    public TickerInfo {
        country = country != null ? country : Country.US;
        industry = industry != null ? industry : "";
    }
}
