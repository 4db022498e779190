package com.fleetbot.fleet_ledger.dto;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

/**
 * Dashboard figures for one week window. Computed per request, never stored.
 */
@Value
@Builder
public class FleetStats {
    LocalDate weekStart;
    LocalDate weekEnd;
    long totalVehicles;
    long activeVehicles;
    BigDecimal weeklyRevenue;
    BigDecimal weeklyProfit;
    BigDecimal totalDeductions;
    // From the summed revenue/profit, not a mean of per-vehicle margins
    double averageProfitMargin;
    @Singular
    List<TopPerformer> topPerformers;
}
