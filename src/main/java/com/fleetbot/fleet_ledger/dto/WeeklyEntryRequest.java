package com.fleetbot.fleet_ledger.dto;

import jakarta.validation.constraints.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Raw weekly input for one vehicle. Derived totals are never part of the request.
 * Mutable so the bot can fill it in one answer at a time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WeeklyEntryRequest {

    @NotNull(message = "Vehicle ID is required")
    private Long vehicleId;

    @NotNull(message = "Week start date is required")
    private LocalDate weekStartDate;

    @NotNull(message = "Week end date is required")
    private LocalDate weekEndDate;

    @NotNull(message = "Cash collected is required")
    @PositiveOrZero(message = "Cash collected must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Cash collected must have at most 12 digits and 2 decimals")
    private BigDecimal cashCollected;

    @NotNull(message = "Online earnings are required")
    @PositiveOrZero(message = "Online earnings must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Online earnings must have at most 12 digits and 2 decimals")
    private BigDecimal onlineEarnings;

    @NotNull(message = "Diesel expense is required")
    @PositiveOrZero(message = "Diesel expense must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Diesel expense must have at most 12 digits and 2 decimals")
    private BigDecimal dieselExpense;

    @NotNull(message = "Tolls/parking is required")
    @PositiveOrZero(message = "Tolls/parking must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Tolls/parking must have at most 12 digits and 2 decimals")
    private BigDecimal tollsParking;

    @NotNull(message = "Maintenance is required")
    @PositiveOrZero(message = "Maintenance must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Maintenance must have at most 12 digits and 2 decimals")
    private BigDecimal maintenanceRepairs;

    @NotNull(message = "Other expenses are required")
    @PositiveOrZero(message = "Other expenses must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Other expenses must have at most 12 digits and 2 decimals")
    private BigDecimal otherExpenses;

    @PositiveOrZero(message = "Trip count must not be negative")
    private Integer totalTrips;

    @PositiveOrZero(message = "Distance must not be negative")
    @Digits(integer = 12, fraction = 2, message = "Distance must have at most 12 digits and 2 decimals")
    private BigDecimal totalDistance;

    @DecimalMin(value = "0.0", message = "Rating must be between 0 and 5")
    @DecimalMax(value = "5.0", message = "Rating must be between 0 and 5")
    private Double averageRating;

    @Size(max = 1000, message = "Notes must be at most 1000 characters")
    private String notes;

    @AssertTrue(message = "Week end date must not be before week start date")
    public boolean isWeekRangeValid() {
        return weekStartDate == null || weekEndDate == null || !weekEndDate.isBefore(weekStartDate);
    }
}
