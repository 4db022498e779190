package com.fleetbot.fleet_ledger.service;

import com.fleetbot.fleet_ledger.dto.LedgerEntryFilter;
import com.fleetbot.fleet_ledger.dto.WeeklyEntryRequest;
import com.fleetbot.fleet_ledger.exception.NotFoundException;
import com.fleetbot.fleet_ledger.exception.StorageException;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.repository.LedgerEntrySpecifications;
import com.fleetbot.fleet_ledger.repository.VehicleRepository;
import com.fleetbot.fleet_ledger.repository.WeeklyLedgerEntryRepository;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Writes and reads weekly ledger entries. One entry per (vehicle, week start); a second
 * submission for the same pair overwrites the first completely (last writer wins).
 * Audit events for these operations are the caller's job.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private static final Sort NEWEST_FIRST = Sort.by(Sort.Order.desc("weekStartDate"), Sort.Order.asc("id"));

    private final VehicleRepository vehicleRepository;
    private final WeeklyLedgerEntryRepository entryRepository;
    private final Validator validator;
    private final Clock clock;

    @Transactional
    public WeeklyLedgerEntry upsertWeeklyEntry(WeeklyEntryRequest request, String submittedBy) {
        validate(request);

        Vehicle vehicle = storage("load vehicle", () -> vehicleRepository.findById(request.getVehicleId()))
                .orElseThrow(() -> NotFoundException.vehicle(request.getVehicleId()));

        Optional<WeeklyLedgerEntry> existing = storage("load entry",
                () -> entryRepository.findByVehicle_IdAndWeekStartDate(vehicle.getId(), request.getWeekStartDate()));

        WeeklyLedgerEntry entry = existing.orElseGet(WeeklyLedgerEntry::new);
        entry.setVehicle(vehicle);
        LedgerCalculator.apply(request, entry);
        entry.setSubmittedBy(submittedBy);
        entry.setSubmittedAt(Instant.now(clock));

        WeeklyLedgerEntry saved = storage("save entry", () -> entryRepository.saveAndFlush(entry));
        log.info("{} weekly entry {} for vehicle {} week {} (revenue {}, profit {})",
                existing.isPresent() ? "Updated" : "Created", saved.getId(), vehicle.getVehicleNumber(),
                saved.getWeekStartDate(), saved.getTotalRevenue(), saved.getNetProfit());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<WeeklyLedgerEntry> getWeeklyEntries(LedgerEntryFilter filter) {
        LedgerEntryFilter effective = filter == null ? LedgerEntryFilter.all() : filter;
        return storage("list entries",
                () -> entryRepository.findAll(LedgerEntrySpecifications.matching(effective), NEWEST_FIRST));
    }

    @Transactional(readOnly = true)
    public WeeklyLedgerEntry getWeeklyEntry(Long entryId) {
        if (entryId == null) {
            throw new ValidationException("Entry ID is required");
        }
        return storage("load entry", () -> entryRepository.findById(entryId))
                .orElseThrow(() -> NotFoundException.entry(entryId));
    }

    @Transactional
    public void deleteWeeklyEntry(Long entryId) {
        WeeklyLedgerEntry entry = getWeeklyEntry(entryId);
        log.info("Deleting weekly entry {} (vehicle {}, week {})",
                entryId, entry.getVehicle().getVehicleNumber(), entry.getWeekStartDate());
        storage("delete entry", () -> {
            entryRepository.delete(entry);
            entryRepository.flush();
            return null;
        });
    }

    private void validate(WeeklyEntryRequest request) {
        if (request == null) {
            throw new ValidationException("Weekly entry is required");
        }
        Set<ConstraintViolation<WeeklyEntryRequest>> violations = validator.validate(request);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .map(ConstraintViolation::getMessage)
                    .sorted()
                    .collect(Collectors.toList());
            log.warn("Rejected weekly entry for vehicle {}: {}", request.getVehicleId(), messages);
            throw new ValidationException(messages);
        }
    }

    private <T> T storage(String operation, Supplier<T> call) {
        try {
            return call.get();
        } catch (DataAccessException e) {
            throw new StorageException("Storage failure during " + operation + ": " + e.getMostSpecificCause().getMessage(), e);
        }
    }
}
