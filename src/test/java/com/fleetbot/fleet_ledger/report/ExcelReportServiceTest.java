package com.fleetbot.fleet_ledger.report;

import com.fleetbot.fleet_ledger.config.FleetLedgerProperties;
import com.fleetbot.fleet_ledger.dto.LedgerTotals;
import com.fleetbot.fleet_ledger.dto.WeekWindow;
import com.fleetbot.fleet_ledger.exception.NotFoundException;
import com.fleetbot.fleet_ledger.model.Vehicle;
import com.fleetbot.fleet_ledger.model.WeeklyLedgerEntry;
import org.apache.poi.ss.usermodel.PrintSetup;
import org.apache.poi.ss.util.CellRangeAddress;
import org.apache.poi.xssf.usermodel.XSSFCell;
import org.apache.poi.xssf.usermodel.XSSFRow;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.time.LocalDate;
import java.util.List;

import static com.fleetbot.fleet_ledger.LedgerTestData.MONDAY;
import static com.fleetbot.fleet_ledger.LedgerTestData.SUNDAY;
import static com.fleetbot.fleet_ledger.LedgerTestData.activeVehicle;
import static com.fleetbot.fleet_ledger.LedgerTestData.entry;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ExcelReportServiceTest {

    private static final WeekWindow WEEK = WeekWindow.of(MONDAY, SUNDAY);

    @Mock
    private ReportDataService reportDataService;

    private ExcelReportService excelReportService;

    @BeforeEach
    void setUp() {
        excelReportService = new ExcelReportService(reportDataService, new FleetLedgerProperties());
    }

    private static WeeklyReportRow row(Vehicle vehicle, LedgerTotals amounts, String notes) {
        return new WeeklyReportRow(vehicle.getVehicleNumber(), vehicle.getDriverName(), vehicle.getPhoneNumber(),
                amounts, notes, amounts != LedgerTotals.ZERO);
    }

    private static WeeklyFleetReport sampleReport() {
        Vehicle abc = activeVehicle(1L, "ABC123");
        Vehicle lossy = activeVehicle(2L, "LOS456");
        Vehicle idle = activeVehicle(3L, "ZZZ999");
        LedgerTotals abcAmounts = LedgerTotals.of(entry(10L, abc, MONDAY, 8000, 3000));
        LedgerTotals lossAmounts = LedgerTotals.of(entry(11L, lossy, MONDAY, 1000, 1300));
        List<WeeklyReportRow> rows = List.of(
                row(abc, abcAmounts, "Good week"),
                row(lossy, lossAmounts, null),
                row(idle, LedgerTotals.ZERO, ""));
        return new WeeklyFleetReport(WEEK, rows, abcAmounts.plus(lossAmounts));
    }

    private static XSSFWorkbook open(byte[] bytes) throws IOException {
        return new XSSFWorkbook(new ByteArrayInputStream(bytes));
    }

    private static String fontColour(XSSFCell cell) {
        return cell.getCellStyle().getFont().getXSSFColor().getARGBHex();
    }

    @Test
    @DisplayName("Weekly workbook has the title, header, widths, print setup and frozen header")
    void weeklyLayout() throws IOException {
        try (XSSFWorkbook workbook = open(excelReportService.renderWeeklyReport(sampleReport()))) {
            XSSFSheet sheet = workbook.getSheet("Weekly Fleet Report");
            assertThat(sheet).isNotNull();
            assertThat(workbook.getProperties().getCoreProperties().getCreator()).isEqualTo("Fleet Manager by Sheet Solved");

            assertThat(sheet.getRow(0).getCell(0).getStringCellValue())
                    .isEqualTo("Weekly Fleet Report - Oct 20 to Oct 26, 2025");
            assertThat(sheet.getMergedRegions()).extracting(CellRangeAddress::formatAsString).contains("A1:N1");
            assertThat(sheet.getRow(0).getHeightInPoints()).isEqualTo(30f);

            XSSFRow header = sheet.getRow(2);
            assertThat(header.getHeightInPoints()).isEqualTo(40f);
            for (int col = 0; col < ExcelReportService.WEEKLY_HEADERS.length; col++) {
                assertThat(header.getCell(col).getStringCellValue()).isEqualTo(ExcelReportService.WEEKLY_HEADERS[col]);
                assertThat(sheet.getColumnWidth(col)).isEqualTo(ExcelReportService.WEEKLY_WIDTHS[col] * 256);
            }
            assertThat(header.getCell(0).getStringCellValue()).isEqualTo("Vehicle #");
            assertThat(header.getCell(13).getStringCellValue()).isEqualTo("Notes");

            assertThat(sheet.getPaneInformation().isFreezePane()).isTrue();
            assertThat(sheet.getPaneInformation().getHorizontalSplitTopRow()).isEqualTo((short) 3);
            assertThat(sheet.getPrintSetup().getLandscape()).isTrue();
            assertThat(sheet.getPrintSetup().getPaperSize()).isEqualTo(PrintSetup.A4_PAPERSIZE);
        }
    }

    @Test
    @DisplayName("Data rows carry amounts, colour-coded margins and zeros for vehicles without entries")
    void weeklyRows() throws IOException {
        try (XSSFWorkbook workbook = open(excelReportService.renderWeeklyReport(sampleReport()))) {
            XSSFSheet sheet = workbook.getSheet("Weekly Fleet Report");

            XSSFRow abc = sheet.getRow(3);
            assertThat(abc.getCell(0).getStringCellValue()).isEqualTo("ABC123");
            assertThat(abc.getCell(1).getStringCellValue()).isEqualTo("Driver ABC123");
            assertThat(abc.getCell(3).getNumericCellValue()).isEqualTo(8000.0);
            assertThat(abc.getCell(5).getNumericCellValue()).isEqualTo(8000.0);
            assertThat(abc.getCell(6).getNumericCellValue()).isEqualTo(3000.0);
            assertThat(abc.getCell(10).getNumericCellValue()).isEqualTo(3000.0);
            assertThat(abc.getCell(11).getNumericCellValue()).isEqualTo(5000.0);
            assertThat(abc.getCell(12).getNumericCellValue()).isEqualTo(62.5);
            assertThat(abc.getCell(13).getStringCellValue()).isEqualTo("Good week");
            assertThat(abc.getCell(3).getCellStyle().getDataFormatString()).isEqualTo("\"R\"#,##0.00");
            assertThat(abc.getCell(12).getCellStyle().getDataFormatString()).isEqualTo("0.00\"%\"");
            assertThat(fontColour(abc.getCell(12))).isEqualToIgnoringCase("FF27AE60");

            XSSFRow loss = sheet.getRow(4);
            assertThat(loss.getCell(11).getNumericCellValue()).isEqualTo(-300.0);
            assertThat(loss.getCell(12).getNumericCellValue()).isEqualTo(-30.0);
            assertThat(fontColour(loss.getCell(12))).isEqualToIgnoringCase("FFE74C3C");
            assertThat(loss.getCell(13).getStringCellValue()).isEmpty();

            XSSFRow idle = sheet.getRow(5);
            assertThat(idle.getCell(0).getStringCellValue()).isEqualTo("ZZZ999");
            for (int col = 3; col <= 12; col++) {
                assertThat(idle.getCell(col).getNumericCellValue()).isZero();
            }
            assertThat(fontColour(idle.getCell(12))).isEqualToIgnoringCase("FF27AE60");

            // Alternating fills
            assertThat(abc.getCell(0).getCellStyle().getFillForegroundColorColor().getARGBHex()).isEqualToIgnoringCase("FFFFFFFF");
            assertThat(loss.getCell(0).getCellStyle().getFillForegroundColorColor().getARGBHex()).isEqualToIgnoringCase("FFF8F9FA");
        }
    }

    @Test
    @DisplayName("The totals row sums each amount column and recomputes the margin")
    void totalsAndSummary() throws IOException {
        try (XSSFWorkbook workbook = open(excelReportService.renderWeeklyReport(sampleReport()))) {
            XSSFSheet sheet = workbook.getSheet("Weekly Fleet Report");

            XSSFRow totals = sheet.getRow(7);
            assertThat((Object) sheet.getRow(6)).isNull();
            assertThat(totals.getCell(0).getStringCellValue()).isEqualTo("TOTAL");
            assertThat(totals.getHeightInPoints()).isEqualTo(25f);
            for (int col = 3; col <= 11; col++) {
                double columnSum = 0;
                for (int r = 3; r <= 5; r++) {
                    columnSum += sheet.getRow(r).getCell(col).getNumericCellValue();
                }
                assertThat(totals.getCell(col).getNumericCellValue()).as("column %d", col).isEqualTo(columnSum);
            }
            // 4700 profit on 9000 revenue
            assertThat(totals.getCell(12).getNumericCellValue()).isEqualTo(52.22);

            assertThat(sheet.getRow(9).getCell(0).getStringCellValue()).isEqualTo("SUMMARY");
            assertThat(sheet.getRow(10).getCell(0).getStringCellValue()).isEqualTo("Total Active Vehicles:");
            assertThat(sheet.getRow(10).getCell(1).getNumericCellValue()).isEqualTo(3.0);
            assertThat(sheet.getRow(11).getCell(1).getNumericCellValue()).isEqualTo(9000.0);
            assertThat(sheet.getRow(12).getCell(1).getNumericCellValue()).isEqualTo(4300.0);
            assertThat(sheet.getRow(13).getCell(1).getNumericCellValue()).isEqualTo(4700.0);
            assertThat(sheet.getRow(14).getCell(0).getStringCellValue()).isEqualTo("Average Profit Margin:");
            assertThat(sheet.getRow(14).getCell(1).getNumericCellValue()).isEqualTo(52.22);
        }
    }

    @Test
    @DisplayName("Vehicle report lists the vehicle's weeks oldest first with no totals row")
    void vehicleReport() throws IOException {
        Vehicle abc = activeVehicle(1L, "ABC123");
        WeeklyLedgerEntry first = entry(1L, abc, MONDAY.minusWeeks(1), 1000, 1200);
        WeeklyLedgerEntry second = entry(2L, abc, MONDAY, 2000, 500);
        second.setNotes("Tyres");
        LocalDate from = MONDAY.minusWeeks(1);
        when(reportDataService.buildVehicleReport(1L, from, SUNDAY))
                .thenReturn(new VehicleHistoryReport(abc, WeekWindow.of(from, SUNDAY), List.of(first, second)));

        try (XSSFWorkbook workbook = open(excelReportService.generateVehicleReport(1L, from, SUNDAY))) {
            XSSFSheet sheet = workbook.getSheet("Vehicle Report");

            assertThat(sheet.getRow(0).getCell(0).getStringCellValue()).isEqualTo("Vehicle Report - ABC123");
            assertThat(sheet.getMergedRegions()).extracting(CellRangeAddress::formatAsString).contains("A1:F1");
            assertThat(sheet.getRow(2).getCell(1).getStringCellValue()).isEqualTo("Driver ABC123");
            assertThat(sheet.getRow(4).getCell(1).getStringCellValue()).isEqualTo("Oct 13, 2025 - Oct 26, 2025");
            assertThat(sheet.getRow(6).getCell(0).getStringCellValue()).isEqualTo("Week Start");

            XSSFRow oldest = sheet.getRow(7);
            assertThat(oldest.getCell(0).getStringCellValue()).isEqualTo("Oct 13, 2025");
            assertThat(oldest.getCell(3).getNumericCellValue()).isEqualTo(-200.0);
            assertThat(oldest.getCell(4).getNumericCellValue()).isEqualTo(-20.0);
            assertThat(fontColour(oldest.getCell(4))).isEqualToIgnoringCase("FFE74C3C");

            XSSFRow latest = sheet.getRow(8);
            assertThat(latest.getCell(0).getStringCellValue()).isEqualTo("Oct 20, 2025");
            assertThat(latest.getCell(4).getNumericCellValue()).isEqualTo(75.0);
            assertThat(latest.getCell(5).getStringCellValue()).isEqualTo("Tyres");

            assertThat(sheet.getLastRowNum()).isEqualTo(8);
        }
    }

    @Test
    void unknownVehicleProducesNoWorkbook() {
        when(reportDataService.buildVehicleReport(42L, MONDAY, SUNDAY)).thenThrow(NotFoundException.vehicle(42L));

        assertThatThrownBy(() -> excelReportService.generateVehicleReport(42L, MONDAY, SUNDAY))
                .isInstanceOf(NotFoundException.class);
    }

    @Test
    void fileNames() {
        assertThat(ExcelReportService.weeklyFileName(WEEK)).isEqualTo("fleet-report-2025-10-20.xlsx");
        assertThat(ExcelReportService.vehicleFileName(activeVehicle(1L, "ABC123"))).isEqualTo("vehicle-report-ABC123.xlsx");
    }
}
