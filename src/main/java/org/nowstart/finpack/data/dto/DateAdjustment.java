package org.nowstart.finpack.data.dto;

import java.time.LocalDate;

public record DateAdjustment(
        LocalDate configuredStart,
        LocalDate configuredEnd,
        LocalDate actualStart,
        LocalDate actualEnd,
        boolean startAdjusted,
        boolean endAdjusted,
        int availableDates,
        int tradingDays
) {
}
