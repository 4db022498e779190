package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import lombok.Value;

import java.util.List;

@Value
public class VehicleHistoryReport {
    Vehicle vehicle;
    WeekWindow window;
    // Oldest first
    List<WeeklyLedgerEntry> entries;
}
