package com.fleetbot.fleet_ledger.repository;

import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

@Repository
public interface WeeklyLedgerEntryRepository extends JpaRepository<WeeklyLedgerEntry, Long>,
        JpaSpecificationExecutor<WeeklyLedgerEntry> {

    Optional<WeeklyLedgerEntry> findByVehicle_IdAndWeekStartDate(Long vehicleId, LocalDate weekStartDate);

    // Entries fully inside [start, end], in insertion order
    List<WeeklyLedgerEntry> findByWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByIdAsc(
            LocalDate start, LocalDate end);

    List<WeeklyLedgerEntry> findByVehicle_IdAndWeekStartDateGreaterThanEqualAndWeekEndDateLessThanEqualOrderByWeekStartDateAsc(
            Long vehicleId, LocalDate start, LocalDate end);

    // Most recent first; callers reverse for charts
    List<WeeklyLedgerEntry> findByOrderByWeekStartDateDescIdDesc(Pageable pageable);

    List<WeeklyLedgerEntry> findByVehicle_IdOrderByWeekStartDateDescIdDesc(Long vehicleId, Pageable pageable);
}
