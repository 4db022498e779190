package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import lombok.Value;

import java.util.List;

/**
 * Everything the weekly fleet workbook and CSV show: one row per active vehicle plus the
 * column totals of those rows.
 */
@Value
public class WeeklyFleetReport {
    WeekWindow window;
    List<WeeklyReportRow> rows;
    LedgerTotals totals;

    public int getActiveVehicleCount() {
        return rows.size();
    }
}
