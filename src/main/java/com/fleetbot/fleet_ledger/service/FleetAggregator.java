package com.fleetbot.fleet_ledger.service;

import com.fleetbot.fleet_ledger.dto.FleetStats;
import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import com.fleetbot.fleet_ledger.dto.TopPerformer;
import com.fleetbot.fleet_ledger.dto.TrendPoint;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pure folds over an already-queried entry set. No state is kept between calls.
 */
public final class FleetAggregator {

    public static final int LEADERBOARD_SIZE = 5;

    private FleetAggregator() {
    }

    public static FleetStats summarize(WeekWindow window, long totalVehicles, long activeVehicles,
                                       List<WeeklyLedgerEntry> entries) {
        LedgerTotals totals = entries.stream()
                .map(LedgerTotals::of)
                .reduce(LedgerTotals.ZERO, LedgerTotals::plus);

        return FleetStats.builder()
                .weekStart(window.getStart())
                .weekEnd(window.getEnd())
                .totalVehicles(totalVehicles)
                .activeVehicles(activeVehicles)
                .weeklyRevenue(totals.getTotalRevenue())
                .weeklyProfit(totals.getNetProfit())
                .totalDeductions(totals.getTotalDeductions())
                .averageProfitMargin(totals.getProfitMargin())
                .topPerformers(topPerformers(entries, LEADERBOARD_SIZE))
                .build();
    }

    /**
     * Highest net profit first. List.sort is stable, so equal profits keep their query order.
     */
    public static List<TopPerformer> topPerformers(List<WeeklyLedgerEntry> entries, int limit) {
        List<WeeklyLedgerEntry> ranked = new ArrayList<>(entries);
        ranked.sort(Comparator.comparing(WeeklyLedgerEntry::getNetProfit).reversed());
        return ranked.stream()
                .limit(limit)
                .map(e -> new TopPerformer(e.getVehicle().getVehicleNumber(), e.getVehicle().getDriverName(), e.getNetProfit()))
                .collect(Collectors.toList());
    }

    // Input is newest first; charts want oldest first
    public static List<TrendPoint> trend(List<WeeklyLedgerEntry> newestFirst) {
        List<TrendPoint> points = new ArrayList<>();
        for (int i = newestFirst.size() - 1; i >= 0; i--) {
            WeeklyLedgerEntry e = newestFirst.get(i);
            points.add(new TrendPoint(e.getWeekStartDate(), e.getTotalRevenue(), e.getNetProfit(),
                    e.getTotalDeductions(), e.getProfitMargin()));
        }
        return points;
    }
}
