package org.nowstart.finpack.data.type;

import java.time.LocalDate;
import java.time.temporal.IsoFields;

public enum RebalanceFrequency {
    DAILY,
    WEEKLY,
    MONTHLY;

    /**
     * Whether {@code current} opens a new rebalance cycle. A null {@code previous} means
     * the first simulated day, which always rebalances.
     */
    public boolean isRebalanceDay(LocalDate previous, LocalDate current) {
        if (previous == null) {
            return true;
        }
        return switch (this) {
            case DAILY -> true;
            case WEEKLY -> previous.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR) != current.get(IsoFields.WEEK_OF_WEEK_BASED_YEAR)
                    || previous.get(IsoFields.WEEK_BASED_YEAR) != current.get(IsoFields.WEEK_BASED_YEAR);
            case MONTHLY -> previous.getMonthValue() != current.getMonthValue()
                    || previous.getYear() != current.getYear();
        };
    }
}
