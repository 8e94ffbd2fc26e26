package org.nowstart.finpack.data.dto;

import java.time.LocalDate;

public record DayReturn(
        LocalDate date,
        double value
) {
}
