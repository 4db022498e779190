package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.exception.NotFoundException;
import com.fleetbot.fleet_ledger.exception.StorageException;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.VehicleStatus;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.repository.VehicleRepository;
import com.fleetbot.fleet_ledger.repository.WeeklyLedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Loads and shapes the data behind the spreadsheet reports. Rendering lives in
 * {@link ExcelReportService} and {@link CsvReportService}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReportDataService {

    private final VehicleRepository vehicleRepository;
    private final WeeklyLedgerEntryRepository entryRepository;
    private final Clock clock;

    /**
     * The week start is moved back to its Monday; a missing start means the current week and
     * a missing end means the Sunday of the start's week.
     */
    public WeekWindow weeklyWindow(LocalDate weekStart, LocalDate weekEnd) {
        LocalDate start = weekStart == null ? null : WeekWindow.mondayOf(weekStart);
        return WeekWindow.resolve(start, weekEnd, clock);
    }

    @Transactional(readOnly = true)
    public WeeklyFleetReport buildWeeklyReport(WeekWindow window) {
        try {
            List<Vehicle> activeVehicles = vehicleRepository.findByStatusOrderByVehicleNumberAsc(VehicleStatus.ACTIVE);
            List<WeeklyLedgerEntry> entries = entryRepository
                    .findByWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByIdAsc(window.getStart(), window.getEnd());

            Map<Long, List<WeeklyLedgerEntry>> byVehicle = new LinkedHashMap<>();
            for (WeeklyLedgerEntry entry : entries) {
                byVehicle.computeIfAbsent(entry.getVehicle().getId(), k -> new ArrayList<>()).add(entry);
            }

            List<WeeklyReportRow> rows = new ArrayList<>();
            LedgerTotals totals = LedgerTotals.ZERO;
            for (Vehicle vehicle : activeVehicles) {
                WeeklyReportRow row = toRow(vehicle, byVehicle.getOrDefault(vehicle.getId(), List.of()));
                rows.add(row);
                totals = totals.plus(row.getAmounts());
            }

            log.info("Weekly report {}..{}: {} active vehicles, {} entries in window",
                    window.getStart(), window.getEnd(), rows.size(), entries.size());
            return new WeeklyFleetReport(window, rows, totals);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load weekly report data: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    @Transactional(readOnly = true)
    public VehicleHistoryReport buildVehicleReport(Long vehicleId, LocalDate startDate, LocalDate endDate) {
        if (vehicleId == null) {
            throw new ValidationException("Vehicle ID is required");
        }
        WeekWindow window = WeekWindow.of(startDate, endDate);
        try {
            Vehicle vehicle = vehicleRepository.findById(vehicleId)
                    .orElseThrow(() -> NotFoundException.vehicle(vehicleId));
            List<WeeklyLedgerEntry> entries = entryRepository
                    .findByVehicle_IdAndWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByWeekStartDateAsc(
                            vehicleId, window.getStart(), window.getEnd());
            return new VehicleHistoryReport(vehicle, window, entries);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load vehicle report data: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    // A window wider than one week can hold several entries for a vehicle; they are summed
    private WeeklyReportRow toRow(Vehicle vehicle, List<WeeklyLedgerEntry> entries) {
        LedgerTotals amounts = entries.stream()
                .map(LedgerTotals::of)
                .reduce(LedgerTotals.ZERO, LedgerTotals::plus);
        String notes = entries.stream()
                .map(WeeklyLedgerEntry::getNotes)
                .filter(Objects::nonNull)
                .filter(n -> !n.isBlank())
                .collect(Collectors.joining("; "));
        return new WeeklyReportRow(vehicle.getVehicleNumber(), vehicle.getDriverName(), vehicle.getPhoneNumber(),
                amounts, notes, !entries.isEmpty());
    }
}
