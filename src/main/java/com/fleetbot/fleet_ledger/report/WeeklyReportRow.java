package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import lombok.Value;

@Value
public class WeeklyReportRow {
    String vehicleNumber;
    String driverName;
    String phoneNumber;
    // Zeros when the vehicle has no entry in the window
    LedgerTotals amounts;
    String notes;
    boolean submitted;
}
