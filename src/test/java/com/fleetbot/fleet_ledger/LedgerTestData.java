package com.fleetbot.fleet_ledger;

import com.fleetbot.fleet_ledger.dto.WeeklyEntryRequest;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.VehicleStatus;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.service.LedgerCalculator;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;

/**
 * Builders for vehicles, requests and entries used across the test suite.
 */
public final class LedgerTestData {

    // Wednesday; its week runs 2025-10-20 .. 2025-10-26
    public static final Instant NOW = Instant.parse("2025-10-22T10:00:00Z");
    public static final Clock FIXED_CLOCK = Clock.fixed(NOW, ZoneOffset.UTC);
    public static final LocalDate MONDAY = LocalDate.of(2025, 10, 20);
    public static final LocalDate SUNDAY = LocalDate.of(2025, 10, 26);

    private LedgerTestData() {
    }

    public static Vehicle vehicle(Long id, String number, VehicleStatus status) {
        Vehicle vehicle = new Vehicle(number, "Driver " + number, "+27 82 000 " + (id == null ? "0000" : String.format("%04d", id)), status);
        vehicle.setId(id);
        return vehicle;
    }

    public static Vehicle activeVehicle(Long id, String number) {
        return vehicle(id, number, VehicleStatus.ACTIVE);
    }

    public static WeeklyEntryRequest request(Long vehicleId, LocalDate weekStart,
                                             double cash, double online,
                                             double diesel, double tolls, double maintenance, double other) {
        return WeeklyEntryRequest.builder()
                .vehicleId(vehicleId)
                .weekStartDate(weekStart)
                .weekEndDate(weekStart.plusDays(6))
                .cashCollected(BigDecimal.valueOf(cash))
                .onlineEarnings(BigDecimal.valueOf(online))
                .dieselExpense(BigDecimal.valueOf(diesel))
                .tollsParking(BigDecimal.valueOf(tolls))
                .maintenanceRepairs(BigDecimal.valueOf(maintenance))
                .otherExpenses(BigDecimal.valueOf(other))
                .build();
    }

    /**
     * Entry with only cash revenue and diesel cost, enough for most aggregation cases.
     */
    public static WeeklyLedgerEntry entry(Long id, Vehicle vehicle, LocalDate weekStart, double revenue, double cost) {
        WeeklyLedgerEntry entry = new WeeklyLedgerEntry();
        entry.setId(id);
        entry.setVehicle(vehicle);
        LedgerCalculator.apply(request(vehicle.getId(), weekStart, revenue, 0, cost, 0, 0, 0), entry);
        return entry;
    }

    public static BigDecimal money(String amount) {
        return new BigDecimal(amount);
    }
}
