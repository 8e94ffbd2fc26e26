package org.nowstart.finpack.data.dto;

import java.time.LocalDate;

public record PeriodStats(
        int tradingDays,
        LocalDate startDate,
        LocalDate endDate,
        DayReturn bestDay,
        DayReturn worstDay
) {
    public static PeriodStats empty() {
        return new PeriodStats(0, null, null, new DayReturn(null, 0.0), new DayReturn(null, 0.0));
    }
}
