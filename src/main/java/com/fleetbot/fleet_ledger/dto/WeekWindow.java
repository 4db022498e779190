package com.fleetbot.fleet_ledger.dto;

import com.fleetbot.fleet_ledger.exception.ValidationException;
import lombok.Value;

import java.time.Clock;
import java.time.DayOfWeek;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAdjusters;

/**
 * Inclusive [start, end] date range used to select ledger entries.
 * Weeks run Monday to Sunday.
 */
@Value
public class WeekWindow {
    LocalDate start;
    LocalDate end;

    public static WeekWindow of(LocalDate start, LocalDate end) {
        if (start == null || end == null) {
            throw new ValidationException("Start date and end date are required");
        }
        if (end.isBefore(start)) {
            throw new ValidationException("End date " + end + " is before start date " + start);
        }
        return new WeekWindow(start, end);
    }

    /**
     * Window starting at {@code start} (or this week's Monday when null) and ending at
     * {@code end} (or the Sunday of the start's week when null).
     */
    public static WeekWindow resolve(LocalDate start, LocalDate end, Clock clock) {
        LocalDate from = start != null ? start : mondayOf(LocalDate.now(clock));
        LocalDate to = end != null ? end : sundayOf(from);
        return of(from, to);
    }

    public static WeekWindow weekOf(LocalDate date) {
        LocalDate monday = mondayOf(date);
        return new WeekWindow(monday, sundayOf(monday));
    }

    public static LocalDate mondayOf(LocalDate date) {
        return date.with(TemporalAdjusters.previousOrSame(DayOfWeek.MONDAY));
    }

    public static LocalDate sundayOf(LocalDate date) {
        return date.with(TemporalAdjusters.nextOrSame(DayOfWeek.SUNDAY));
    }

    // Caller input is YYYY-MM-DD
    public static LocalDate parseDate(String text) {
        if (text == null || text.isBlank()) {
            throw new ValidationException("A date is required (YYYY-MM-DD)");
        }
        try {
            return LocalDate.parse(text.trim());
        } catch (DateTimeParseException e) {
            throw new ValidationException("Invalid date '" + text.trim() + "'. Please use YYYY-MM-DD.");
        }
    }
}
