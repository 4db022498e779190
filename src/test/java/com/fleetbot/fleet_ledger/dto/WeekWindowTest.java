package com.fleetbot.fleet_ledger.dto;

import com.fleetbot.fleet_ledger.exception.ValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static com.fleetbot.fleet_ledger.LedgerTestData.FIXED_CLOCK;
import static com.fleetbot.fleet_ledger.LedgerTestData.MONDAY;
import static com.fleetbot.fleet_ledger.LedgerTestData.SUNDAY;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class WeekWindowTest {

    @Test
    @DisplayName("No start means the current Monday to Sunday")
    void defaultsToCurrentWeek() {
        WeekWindow window = WeekWindow.resolve(null, null, FIXED_CLOCK);

        assertThat(window.getStart()).isEqualTo(MONDAY);
        assertThat(window.getEnd()).isEqualTo(SUNDAY);
    }

    @Test
    @DisplayName("A given start is kept as is and ends on the Sunday of its week")
    void explicitStart() {
        LocalDate wednesday = LocalDate.of(2025, 10, 15);

        WeekWindow window = WeekWindow.resolve(wednesday, null, FIXED_CLOCK);

        assertThat(window.getStart()).isEqualTo(wednesday);
        assertThat(window.getEnd()).isEqualTo(LocalDate.of(2025, 10, 19));
    }

    @Test
    @DisplayName("An explicit end overrides the derived Sunday")
    void explicitEnd() {
        WeekWindow window = WeekWindow.resolve(MONDAY.minusWeeks(4), SUNDAY, FIXED_CLOCK);

        assertThat(window.getStart()).isEqualTo(LocalDate.of(2025, 9, 22));
        assertThat(window.getEnd()).isEqualTo(SUNDAY);
    }

    @Test
    void weekOfAnyDay() {
        assertThat(WeekWindow.weekOf(SUNDAY)).isEqualTo(WeekWindow.of(MONDAY, SUNDAY));
        assertThat(WeekWindow.weekOf(MONDAY)).isEqualTo(WeekWindow.of(MONDAY, SUNDAY));
    }

    @Test
    @DisplayName("End before start is rejected")
    void endBeforeStart() {
        assertThatThrownBy(() -> WeekWindow.of(SUNDAY, MONDAY))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("before start date");
    }

    @Test
    @DisplayName("Missing dates are a validation error, not a default")
    void missingDates() {
        assertThatThrownBy(() -> WeekWindow.of(null, SUNDAY))
                .isInstanceOf(ValidationException.class)
                .hasMessage("Start date and end date are required");
    }

    @Test
    void parseDate() {
        assertThat(WeekWindow.parseDate(" 2025-10-20 ")).isEqualTo(MONDAY);
        assertThatThrownBy(() -> WeekWindow.parseDate("20/10/2025"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("YYYY-MM-DD");
        assertThatThrownBy(() -> WeekWindow.parseDate(""))
                .isInstanceOf(ValidationException.class);
    }
}
