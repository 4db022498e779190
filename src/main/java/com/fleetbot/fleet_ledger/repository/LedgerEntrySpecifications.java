package com.fleetbot.fleet_ledger.repository;

import com.fleetbot.fleet_ledger.dto.LedgerEntryFilter;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import org.springframework.data.jpa.domain.Specification;

import java.time.LocalDate;

public final class LedgerEntrySpecifications {

    private LedgerEntrySpecifications() {
    }

    public static Specification<WeeklyLedgerEntry> forVehicle(Long vehicleId) {
        return (root, query, cb) -> cb.equal(root.get("vehicle").get("id"), vehicleId);
    }

    public static Specification<WeeklyLedgerEntry> startingOnOrAfter(LocalDate weekStart) {
        return (root, query, cb) -> cb.greaterThanOrEqualTo(root.get("weekStartDate"), weekStart);
    }

    public static Specification<WeeklyLedgerEntry> endingOnOrBefore(LocalDate weekEnd) {
        return (root, query, cb) -> cb.lessThanOrEqualTo(root.get("weekEndDate"), weekEnd);
    }

    /**
     * Combines whichever filter fields are set. An empty filter matches every entry.
     */
    public static Specification<WeeklyLedgerEntry> matching(LedgerEntryFilter filter) {
        Specification<WeeklyLedgerEntry> spec = Specification.where(null);
        if (filter.getVehicleId() != null) {
            spec = spec.and(forVehicle(filter.getVehicleId()));
        }
        if (filter.getWeekStart() != null) {
            spec = spec.and(startingOnOrAfter(filter.getWeekStart()));
        }
        if (filter.getWeekEnd() != null) {
            spec = spec.and(endingOnOrBefore(filter.getWeekEnd()));
        }
        return spec;
    }
}
