package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import com.fleetbot.fleet_ledger.service.LedgerCalculator;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

@Slf4j
@Service
public class CsvReportService {

    public static String weeklyFileName(WeeklyFleetReport report) {
        return "fleet-report-" + report.getWindow().getStart() + ".csv";
    }

    /**
     * Same content as the weekly workbook: title, header, one row per active vehicle,
     * totals and the summary block.
     */
    public byte[] generateWeeklyReportCsv(WeeklyFleetReport report) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CSVPrinter printer = new CSVPrinter(new OutputStreamWriter(out, StandardCharsets.UTF_8), CSVFormat.DEFAULT)) {
            printer.printRecord(ExcelReportService.weeklyTitle(report.getWindow()));
            printer.printRecord((Object[]) ExcelReportService.WEEKLY_HEADERS);

            for (WeeklyReportRow row : report.getRows()) {
                List<Object> record = new ArrayList<>();
                record.add(row.getVehicleNumber());
                record.add(row.getDriverName());
                record.add(row.getPhoneNumber());
                addAmounts(record, row.getAmounts());
                record.add(row.getNotes());
                printer.printRecord(record);
            }
            printer.printRecord(); // Empty line

            List<Object> totals = new ArrayList<>(List.of("TOTAL", "", ""));
            addAmounts(totals, report.getTotals());
            totals.add("");
            printer.printRecord(totals);
            printer.printRecord(); // Empty line

            LedgerTotals sum = report.getTotals();
            printer.printRecord("SUMMARY");
            printer.printRecord("Total Active Vehicles", report.getActiveVehicleCount());
            printer.printRecord("Total Revenue", plain(sum.getTotalRevenue()));
            printer.printRecord("Total Deductions", plain(sum.getTotalDeductions()));
            printer.printRecord("Total Net Profit", plain(sum.getNetProfit()));
            printer.printRecord("Average Profit Margin", percent(sum.getProfitMargin()));
        }
        log.info("Generated weekly fleet CSV for {}: {} rows", report.getWindow().getStart(), report.getRows().size());
        return out.toByteArray();
    }

    private void addAmounts(List<Object> record, LedgerTotals amounts) {
        record.add(plain(amounts.getCashCollected()));
        record.add(plain(amounts.getOnlineEarnings()));
        record.add(plain(amounts.getTotalRevenue()));
        record.add(plain(amounts.getDieselExpense()));
        record.add(plain(amounts.getTollsParking()));
        record.add(plain(amounts.getMaintenanceRepairs()));
        record.add(plain(amounts.getOtherExpenses()));
        record.add(plain(amounts.getTotalDeductions()));
        record.add(plain(amounts.getNetProfit()));
        record.add(percent(amounts.getProfitMargin()));
    }

    private static String plain(BigDecimal amount) {
        return LedgerCalculator.money(amount).toPlainString();
    }

    private static String percent(double margin) {
        return String.format(Locale.ROOT, "%.2f", LedgerCalculator.roundForDisplay(margin));
    }
}
