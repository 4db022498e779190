package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.config.FleetLedgerProperties;
import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import com.fleetbot.fleet_ledger.service.LedgerCalculator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.PrintSetup;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

/**
 * Renders the weekly fleet report and the single-vehicle report as .xlsx workbooks.
 * Workbooks are built in memory and returned as bytes; nothing is written to disk.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ExcelReportService {

    static final String WEEKLY_SHEET = "Weekly Fleet Report";
    static final String VEHICLE_SHEET = "Vehicle Report";

    static final String[] WEEKLY_HEADERS = {
            "Vehicle #", "Driver Name", "Phone", "Cash Collected", "Online Earnings", "Total Revenue",
            "Diesel", "Tolls/Parking", "Maintenance", "Other Expenses", "Total Deductions", "Net Profit",
            "Profit %", "Notes"
    };
    // Fixed widths in characters, one per header
    static final int[] WEEKLY_WIDTHS = {12, 20, 15, 14, 14, 14, 12, 14, 14, 14, 14, 14, 10, 25};

    static final String[] VEHICLE_HEADERS = {"Week Start", "Total Revenue", "Total Deductions", "Net Profit", "Profit %", "Notes"};
    static final int[] VEHICLE_WIDTHS = {16, 16, 16, 16, 10, 30};

    // Row indexes are zero-based: title, blank, header, then data
    static final int TITLE_ROW = 0;
    static final int HEADER_ROW = 2;
    static final int FIRST_DATA_ROW = 3;
    static final int VEHICLE_HEADER_ROW = 6;

    private static final int MARGIN_COLUMN = 12;
    private static final DateTimeFormatter SHORT_DATE = DateTimeFormatter.ofPattern("MMM dd", Locale.ENGLISH);
    private static final DateTimeFormatter LONG_DATE = DateTimeFormatter.ofPattern("MMM dd, yyyy", Locale.ENGLISH);

    private final ReportDataService reportDataService;
    private final FleetLedgerProperties properties;

    public byte[] generateWeeklyReport(LocalDate weekStart, LocalDate weekEnd) {
        WeekWindow window = reportDataService.weeklyWindow(weekStart, weekEnd);
        return renderWeeklyReport(reportDataService.buildWeeklyReport(window));
    }

    public byte[] generateVehicleReport(Long vehicleId, LocalDate startDate, LocalDate endDate) {
        return renderVehicleReport(reportDataService.buildVehicleReport(vehicleId, startDate, endDate));
    }

    public static String weeklyFileName(WeekWindow window) {
        return "fleet-report-" + window.getStart() + ".xlsx";
    }

    public static String vehicleFileName(Vehicle vehicle) {
        return "vehicle-report-" + vehicle.getVehicleNumber() + ".xlsx";
    }

    public static String weeklyTitle(WeekWindow window) {
        return "Weekly Fleet Report - " + window.getStart().format(SHORT_DATE) + " to " + window.getEnd().format(LONG_DATE);
    }

    public byte[] renderWeeklyReport(WeeklyFleetReport report) {
        try (XSSFWorkbook workbook = newWorkbook()) {
            WorkbookStyles styles = new WorkbookStyles(workbook, properties.getReport().getCurrencySymbol());
            XSSFSheet sheet = workbook.createSheet(WEEKLY_SHEET);
            sheet.getPrintSetup().setLandscape(true);
            sheet.getPrintSetup().setPaperSize(PrintSetup.A4_PAPERSIZE);
            setWidths(sheet, WEEKLY_WIDTHS);

            // Title
            XSSFRow titleRow = sheet.createRow(TITLE_ROW);
            titleRow.setHeightInPoints(30);
            for (int col = 0; col < WEEKLY_HEADERS.length; col++) {
                titleRow.createCell(col).setCellStyle(styles.title);
            }
            titleRow.getCell(0).setCellValue(weeklyTitle(report.getWindow()));
            sheet.addMergedRegion(new CellRangeAddress(TITLE_ROW, TITLE_ROW, 0, WEEKLY_HEADERS.length - 1));

            // Header
            XSSFRow headerRow = sheet.createRow(HEADER_ROW);
            headerRow.setHeightInPoints(40);
            for (int col = 0; col < WEEKLY_HEADERS.length; col++) {
                text(headerRow, col, WEEKLY_HEADERS[col], styles.header);
            }

            // One row per active vehicle
            int rowIndex = FIRST_DATA_ROW;
            for (int i = 0; i < report.getRows().size(); i++) {
                WeeklyReportRow data = report.getRows().get(i);
                XSSFRow row = sheet.createRow(rowIndex++);
                text(row, 0, data.getVehicleNumber(), styles.rowText(i));
                text(row, 1, data.getDriverName(), styles.rowText(i));
                text(row, 2, data.getPhoneNumber(), styles.rowText(i));
                amountCells(row, data.getAmounts(), styles.rowMoney(i));
                double margin = LedgerCalculator.roundForDisplay(data.getAmounts().getProfitMargin());
                number(row, MARGIN_COLUMN, margin, styles.rowMargin(i, margin));
                text(row, 13, data.getNotes(), styles.rowText(i));
            }

            // Totals, after one blank row
            XSSFRow totalsRow = sheet.createRow(rowIndex + 1);
            totalsRow.setHeightInPoints(25);
            LedgerTotals totals = report.getTotals();
            text(totalsRow, 0, "TOTAL", styles.totalText);
            text(totalsRow, 1, "", styles.totalText);
            text(totalsRow, 2, "", styles.totalText);
            amountCells(totalsRow, totals, styles.totalMoney);
            number(totalsRow, MARGIN_COLUMN, LedgerCalculator.roundForDisplay(totals.getProfitMargin()), styles.totalPercent);
            text(totalsRow, 13, "", styles.totalText);

            addSummarySection(sheet, rowIndex + 3, report, styles);

            sheet.createFreezePane(0, FIRST_DATA_ROW);

            byte[] bytes = write(workbook);
            log.info("Generated weekly fleet workbook for {}..{}: {} rows, {} bytes",
                    report.getWindow().getStart(), report.getWindow().getEnd(), report.getRows().size(), bytes.length);
            return bytes;
        } catch (IOException e) {
            log.error("Failed to generate weekly fleet workbook", e);
            throw new IllegalStateException("Failed to generate weekly fleet workbook: " + e.getMessage(), e);
        }
    }

    public byte[] renderVehicleReport(VehicleHistoryReport report) {
        Vehicle vehicle = report.getVehicle();
        try (XSSFWorkbook workbook = newWorkbook()) {
            WorkbookStyles styles = new WorkbookStyles(workbook, properties.getReport().getCurrencySymbol());
            XSSFSheet sheet = workbook.createSheet(VEHICLE_SHEET);
            setWidths(sheet, VEHICLE_WIDTHS);

            XSSFRow titleRow = sheet.createRow(TITLE_ROW);
            titleRow.setHeightInPoints(30);
            text(titleRow, 0, "Vehicle Report - " + vehicle.getVehicleNumber(), styles.plainTitle);
            sheet.addMergedRegion(new CellRangeAddress(TITLE_ROW, TITLE_ROW, 0, VEHICLE_HEADERS.length - 1));

            infoRow(sheet, 2, "Driver:", vehicle.getDriverName(), styles);
            infoRow(sheet, 3, "Phone:", vehicle.getPhoneNumber(), styles);
            infoRow(sheet, 4, "Period:", report.getWindow().getStart().format(LONG_DATE) + " - "
                    + report.getWindow().getEnd().format(LONG_DATE), styles);

            XSSFRow headerRow = sheet.createRow(VEHICLE_HEADER_ROW);
            for (int col = 0; col < VEHICLE_HEADERS.length; col++) {
                text(headerRow, col, VEHICLE_HEADERS[col], styles.plainHeader);
            }

            // No totals row here, unlike the fleet report
            int rowIndex = VEHICLE_HEADER_ROW + 1;
            for (WeeklyLedgerEntry entry : report.getEntries()) {
                XSSFRow row = sheet.createRow(rowIndex++);
                row.createCell(0).setCellValue(entry.getWeekStartDate().format(LONG_DATE));
                number(row, 1, entry.getTotalRevenue(), styles.money);
                number(row, 2, entry.getTotalDeductions(), styles.money);
                number(row, 3, entry.getNetProfit(), styles.money);
                double margin = LedgerCalculator.roundForDisplay(entry.getProfitMargin());
                number(row, 4, margin, styles.margin(margin));
                row.createCell(5).setCellValue(entry.getNotes() == null ? "" : entry.getNotes());
            }

            byte[] bytes = write(workbook);
            log.info("Generated vehicle workbook for {} ({}..{}): {} entries, {} bytes", vehicle.getVehicleNumber(),
                    report.getWindow().getStart(), report.getWindow().getEnd(), report.getEntries().size(), bytes.length);
            return bytes;
        } catch (IOException e) {
            log.error("Failed to generate vehicle workbook for {}", vehicle.getVehicleNumber(), e);
            throw new IllegalStateException("Failed to generate vehicle workbook: " + e.getMessage(), e);
        }
    }

    private void addSummarySection(XSSFSheet sheet, int startRow, WeeklyFleetReport report, WorkbookStyles styles) {
        XSSFRow titleRow = sheet.createRow(startRow);
        text(titleRow, 0, "SUMMARY", styles.summaryTitle);

        LedgerTotals totals = report.getTotals();
        summaryRow(sheet, startRow + 1, "Total Active Vehicles:", report.getActiveVehicleCount(), null, styles);
        summaryRow(sheet, startRow + 2, "Total Revenue:", totals.getTotalRevenue().doubleValue(), styles.money, styles);
        summaryRow(sheet, startRow + 3, "Total Deductions:", totals.getTotalDeductions().doubleValue(), styles.money, styles);
        summaryRow(sheet, startRow + 4, "Total Net Profit:", totals.getNetProfit().doubleValue(), styles.money, styles);
        summaryRow(sheet, startRow + 5, "Average Profit Margin:",
                LedgerCalculator.roundForDisplay(totals.getProfitMargin()), styles.percent, styles);
    }

    private void summaryRow(XSSFSheet sheet, int rowIndex, String label, double value, XSSFCellStyle valueStyle,
                            WorkbookStyles styles) {
        XSSFRow row = sheet.createRow(rowIndex);
        text(row, 0, label, styles.label);
        XSSFCell cell = row.createCell(1);
        cell.setCellValue(value);
        if (valueStyle != null) {
            cell.setCellStyle(valueStyle);
        }
    }

    private void infoRow(XSSFSheet sheet, int rowIndex, String label, String value, WorkbookStyles styles) {
        XSSFRow row = sheet.createRow(rowIndex);
        text(row, 0, label, styles.label);
        row.createCell(1).setCellValue(value);
    }

    // Columns D..L: cash through net profit
    private void amountCells(XSSFRow row, LedgerTotals amounts, XSSFCellStyle style) {
        List<BigDecimal> values = List.of(
                amounts.getCashCollected(), amounts.getOnlineEarnings(), amounts.getTotalRevenue(),
                amounts.getDieselExpense(), amounts.getTollsParking(), amounts.getMaintenanceRepairs(),
                amounts.getOtherExpenses(), amounts.getTotalDeductions(), amounts.getNetProfit());
        for (int i = 0; i < values.size(); i++) {
            number(row, 3 + i, values.get(i), style);
        }
    }

    private XSSFWorkbook newWorkbook() {
        XSSFWorkbook workbook = new XSSFWorkbook();
        workbook.getProperties().getCoreProperties().setCreator(properties.getReport().getCreator());
        return workbook;
    }

    private static void setWidths(XSSFSheet sheet, int[] widths) {
        for (int col = 0; col < widths.length; col++) {
            sheet.setColumnWidth(col, widths[col] * 256);
        }
    }

    private static void text(XSSFRow row, int col, String value, XSSFCellStyle style) {
        XSSFCell cell = row.createCell(col);
        cell.setCellValue(value == null ? "" : value);
        cell.setCellStyle(style);
    }

    private static void number(XSSFRow row, int col, BigDecimal value, XSSFCellStyle style) {
        number(row, col, value.doubleValue(), style);
    }

    private static void number(XSSFRow row, int col, double value, XSSFCellStyle style) {
        XSSFCell cell = row.createCell(col);
        cell.setCellValue(value);
        cell.setCellStyle(style);
    }

    private static byte[] write(XSSFWorkbook workbook) throws IOException {
        try (ByteArrayOutputStream out = new ByteArrayOutputStream()) {
            workbook.write(out);
            return out.toByteArray();
        }
    }
}
