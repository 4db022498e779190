package com.fleetbot.fleet_ledger.service;

import com.fleetbot.fleet_ledger.config.FleetLedgerProperties;
import com.fleetbot.fleet_ledger.dto.FleetStats;
import com.fleetbot.fleet_ledger.dto.TrendPoint;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.exception.StorageException;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.VehicleStatus;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.repository.VehicleRepository;
import com.fleetbot.fleet_ledger.repository.WeeklyLedgerEntryRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class AggregationService {

    private final VehicleRepository vehicleRepository;
    private final WeeklyLedgerEntryRepository entryRepository;
    private final FleetLedgerProperties properties;
    private final Clock clock;

    /**
     * Fleet figures for the week starting at {@code weekStart} (this week's Monday when null),
     * ending on the Sunday of that week.
     */
    @Transactional(readOnly = true)
    public FleetStats getFleetStats(LocalDate weekStart) {
        WeekWindow window = WeekWindow.resolve(weekStart, null, clock);
        try {
            long totalVehicles = vehicleRepository.count();
            long activeVehicles = vehicleRepository.countByStatus(VehicleStatus.ACTIVE);
            List<WeeklyLedgerEntry> entries = entryRepository
                    .findByWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByIdAsc(window.getStart(), window.getEnd());

            log.info("Fleet stats for {}..{}: {} vehicles, {} entries", window.getStart(), window.getEnd(), totalVehicles, entries.size());
            return FleetAggregator.summarize(window, totalVehicles, activeVehicles, entries);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load fleet stats: " + e.getMostSpecificCause().getMessage(), e);
        }
    }

    /**
     * The {@code weeks} most recent entries (for one vehicle when {@code vehicleId} is set),
     * oldest first. An unknown vehicle simply has no points.
     */
    @Transactional(readOnly = true)
    public List<TrendPoint> getTrend(Long vehicleId, Integer weeks) {
        int count = weeks == null ? properties.getTrend().getDefaultWeeks() : weeks;
        if (count < 1) {
            throw new ValidationException("Number of weeks must be at least 1");
        }
        PageRequest page = PageRequest.of(0, count);
        try {
            List<WeeklyLedgerEntry> newestFirst = vehicleId == null
                    ? entryRepository.findByOrderByWeekStartDateDescIdDesc(page)
                    : entryRepository.findByVehicle_IdOrderByWeekStartDateDescIdDesc(vehicleId, page);
            return FleetAggregator.trend(newestFirst);
        } catch (DataAccessException e) {
            throw new StorageException("Failed to load trend: " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
