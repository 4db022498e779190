package com.fleetbot.fleet_ledger.service;

import com.fleetbot.fleet_ledger.dto.WeeklyEntryRequest;
import com.fleetbot.fleet_ledger.exception.ValidationException;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;

/**
 * Derives revenue, deductions, profit and margin from the six raw amounts.
 * Derived values are always recomputed here and never taken from the caller.
 */
public final class LedgerCalculator {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);
    private static final int MONEY_SCALE = 2;

    private LedgerCalculator() {
    }

    public static BigDecimal totalRevenue(BigDecimal cash, BigDecimal online) {
        return cash.add(online);
    }

    public static BigDecimal totalDeductions(BigDecimal diesel, BigDecimal tolls, BigDecimal maintenance, BigDecimal other) {
        return diesel.add(tolls).add(maintenance).add(other);
    }

    public static BigDecimal netProfit(BigDecimal totalRevenue, BigDecimal totalDeductions) {
        return totalRevenue.subtract(totalDeductions);
    }

    /**
     * netProfit / totalRevenue * 100, or 0 when there is no positive revenue.
     */
    public static double profitMargin(BigDecimal totalRevenue, BigDecimal netProfit) {
        if (totalRevenue.signum() <= 0) {
            return 0;
        }
        return netProfit.multiply(HUNDRED).divide(totalRevenue, MathContext.DECIMAL64).doubleValue();
    }

    // Display rounding for report consumers; stored margins keep full precision
    public static double roundForDisplay(double value) {
        return BigDecimal.valueOf(value).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }

    public static BigDecimal money(BigDecimal amount) {
        return amount.setScale(MONEY_SCALE, RoundingMode.HALF_UP);
    }

    /**
     * Raw amounts are stored as given. Anything finer than a cent is rejected, never rounded.
     */
    static BigDecimal exactMoney(BigDecimal amount) {
        try {
            return amount.setScale(MONEY_SCALE, RoundingMode.UNNECESSARY);
        } catch (ArithmeticException e) {
            throw new ValidationException("Amount " + amount.toPlainString() + " has more than 2 decimal places");
        }
    }

    /**
     * Overwrites every raw and derived field of {@code entry} from {@code request}.
     * Optional metrics and notes are replaced too, so nothing from an earlier submission survives.
     */
    public static WeeklyLedgerEntry apply(WeeklyEntryRequest request, WeeklyLedgerEntry entry) {
        entry.setWeekStartDate(request.getWeekStartDate());
        entry.setWeekEndDate(request.getWeekEndDate());

        entry.setCashCollected(exactMoney(request.getCashCollected()));
        entry.setOnlineEarnings(exactMoney(request.getOnlineEarnings()));
        entry.setDieselExpense(exactMoney(request.getDieselExpense()));
        entry.setTollsParking(exactMoney(request.getTollsParking()));
        entry.setMaintenanceRepairs(exactMoney(request.getMaintenanceRepairs()));
        entry.setOtherExpenses(exactMoney(request.getOtherExpenses()));

        entry.setTotalTrips(request.getTotalTrips());
        entry.setTotalDistance(request.getTotalDistance());
        entry.setAverageRating(request.getAverageRating());
        entry.setNotes(request.getNotes() == null ? null : request.getNotes().trim());

        recompute(entry);
        return entry;
    }

    public static void recompute(WeeklyLedgerEntry entry) {
        BigDecimal revenue = totalRevenue(entry.getCashCollected(), entry.getOnlineEarnings());
        BigDecimal deductions = totalDeductions(entry.getDieselExpense(), entry.getTollsParking(),
                entry.getMaintenanceRepairs(), entry.getOtherExpenses());
        BigDecimal profit = netProfit(revenue, deductions);

        entry.setTotalRevenue(revenue);
        entry.setTotalDeductions(deductions);
        entry.setNetProfit(profit);
        entry.setProfitMargin(profitMargin(revenue, profit));
    }
}
