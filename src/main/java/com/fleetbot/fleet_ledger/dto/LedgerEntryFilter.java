package com.fleetbot.fleet_ledger.dto;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDate;

@Value
@Builder
public class LedgerEntryFilter {
    Long vehicleId;
    LocalDate weekStart;
    LocalDate weekEnd;

    public static LedgerEntryFilter all() {
        return LedgerEntryFilter.builder().build();
    }
}
