package org.nowstart.finpack.data.dto;

import java.time.LocalDate;

/**
 * Worst peak-to-trough decline as a positive fraction, with the peak and trough dates.
 */
public record MaxDrawdown(
        double value,
        LocalDate startDate,
        LocalDate endDate
) {
    public static MaxDrawdown none() {
        return new MaxDrawdown(0.0, null, null);
    }
}
