package org.nowstart.finpack.data.dto;

import java.time.LocalDate;

public record BacktestProgress(
        int current,
        int total,
        LocalDate date,
        double equity
) {
}
