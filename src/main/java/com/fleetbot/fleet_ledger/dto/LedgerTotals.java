package com.fleetbot.fleet_ledger.dto;

import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.service.LedgerCalculator;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Column-wise sums of one or more ledger entries. The margin is recomputed from the
 * summed revenue and profit, never averaged.
 */
@Value
public class LedgerTotals {

    public static final LedgerTotals ZERO = new LedgerTotals(BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO,
            BigDecimal.ZERO, BigDecimal.ZERO, BigDecimal.ZERO);

    BigDecimal cashCollected;
    BigDecimal onlineEarnings;
    BigDecimal dieselExpense;
    BigDecimal tollsParking;
    BigDecimal maintenanceRepairs;
    BigDecimal otherExpenses;

    public static LedgerTotals of(WeeklyLedgerEntry entry) {
        return new LedgerTotals(entry.getCashCollected(), entry.getOnlineEarnings(), entry.getDieselExpense(),
                entry.getTollsParking(), entry.getMaintenanceRepairs(), entry.getOtherExpenses());
    }

    public LedgerTotals plus(LedgerTotals other) {
        return new LedgerTotals(
                cashCollected.add(other.cashCollected),
                onlineEarnings.add(other.onlineEarnings),
                dieselExpense.add(other.dieselExpense),
                tollsParking.add(other.tollsParking),
                maintenanceRepairs.add(other.maintenanceRepairs),
                otherExpenses.add(other.otherExpenses));
    }

    public BigDecimal getTotalRevenue() {
        return LedgerCalculator.totalRevenue(cashCollected, onlineEarnings);
    }

    public BigDecimal getTotalDeductions() {
        return LedgerCalculator.totalDeductions(dieselExpense, tollsParking, maintenanceRepairs, otherExpenses);
    }

    public BigDecimal getNetProfit() {
        return LedgerCalculator.netProfit(getTotalRevenue(), getTotalDeductions());
    }

    public double getProfitMargin() {
        return LedgerCalculator.profitMargin(getTotalRevenue(), getNetProfit());
    }
}
