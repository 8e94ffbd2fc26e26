package org.nowstart.finpack.data.type;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.LocalDate;
import org.junit.jupiter.api.Test;

class RebalanceFrequencyTest {

    @Test
    void isRebalanceDay_firstSimulatedDayAlwaysRebalances() {
        LocalDate midWeek = LocalDate.of(2024, 1, 17);

        assertThat(RebalanceFrequency.DAILY.isRebalanceDay(null, midWeek)).isTrue();
        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(null, midWeek)).isTrue();
        assertThat(RebalanceFrequency.MONTHLY.isRebalanceDay(null, midWeek)).isTrue();
    }

    @Test
    void isRebalanceDay_dailyRebalancesEveryDay() {
        assertThat(RebalanceFrequency.DAILY.isRebalanceDay(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 3))).isTrue();
    }

    @Test
    void isRebalanceDay_weeklyRebalancesOnFirstTradingDayOfIsoWeek() {
        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(LocalDate.of(2024, 1, 2), LocalDate.of(2024, 1, 5))).isFalse();
        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 8))).isTrue();
        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(LocalDate.of(2024, 1, 5), LocalDate.of(2024, 1, 10))).isTrue();
    }

    @Test
    void isRebalanceDay_weeklyFollowsWeekBasedYearAcrossNewYear() {
        LocalDate friday = LocalDate.of(2024, 12, 27);
        LocalDate monday = LocalDate.of(2024, 12, 30);
        LocalDate thursday = LocalDate.of(2025, 1, 2);

        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(friday, monday)).isTrue();
        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(monday, thursday)).isFalse();
        assertThat(RebalanceFrequency.WEEKLY.isRebalanceDay(LocalDate.of(2024, 1, 3), LocalDate.of(2025, 1, 8))).isTrue();
    }

    @Test
    void isRebalanceDay_monthlyRebalancesOnMonthRollover() {
        assertThat(RebalanceFrequency.MONTHLY.isRebalanceDay(LocalDate.of(2024, 1, 30), LocalDate.of(2024, 1, 31))).isFalse();
        assertThat(RebalanceFrequency.MONTHLY.isRebalanceDay(LocalDate.of(2024, 1, 31), LocalDate.of(2024, 2, 1))).isTrue();
        assertThat(RebalanceFrequency.MONTHLY.isRebalanceDay(LocalDate.of(2023, 12, 29), LocalDate.of(2024, 1, 2))).isTrue();
        assertThat(RebalanceFrequency.MONTHLY.isRebalanceDay(LocalDate.of(2024, 3, 15), LocalDate.of(2025, 3, 3))).isTrue();
    }
}
