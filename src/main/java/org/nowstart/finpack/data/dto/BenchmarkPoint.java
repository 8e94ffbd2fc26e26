package org.nowstart.finpack.data.dto;

import java.time.LocalDate;

public record BenchmarkPoint(
        LocalDate date,
        double equity
) {
}
