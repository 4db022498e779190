package com.fleetbot.fleet_ledger.report;

import org.apache.poi.ss.usermodel.BorderStyle;
import org.apache.poi.ss.usermodel.FillPatternType;
import org.apache.poi.ss.usermodel.HorizontalAlignment;
import org.apache.poi.ss.usermodel.VerticalAlignment;
import org.apache.poi.xssf.usermodel.XSSFCellStyle;
import org.apache.poi.xssf.usermodel.XSSFColor;
import org.apache.poi.xssf.usermodel.XSSFFont;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.util.EnumMap;
import java.util.Map;

/**
 * Cell styles for one workbook. POI caps the number of styles per file, so each style is
 * created once here and shared by every cell that needs it.
 */
class WorkbookStyles {

    static final String TITLE_FILL = "2C3E50";
    static final String HEADER_FILL = "34495E";
    static final String EVEN_ROW_FILL = "FFFFFF";
    static final String ODD_ROW_FILL = "F8F9FA";
    static final String TOTAL_FILL = "F39C12";
    static final String GRID_BORDER = "D3D3D3";
    static final String WHITE = "FFFFFF";

    static final String PERCENT_FORMAT = "0.00\"%\"";

    private final XSSFWorkbook workbook;
    private final short moneyFormat;
    private final short percentFormat;

    final XSSFCellStyle title;
    final XSSFCellStyle plainTitle;
    final XSSFCellStyle header;
    final XSSFCellStyle plainHeader;
    final XSSFCellStyle totalText;
    final XSSFCellStyle totalMoney;
    final XSSFCellStyle totalPercent;
    final XSSFCellStyle summaryTitle;
    final XSSFCellStyle label;
    final XSSFCellStyle money;
    final XSSFCellStyle percent;

    private final XSSFCellStyle[] rowText = new XSSFCellStyle[2];
    private final XSSFCellStyle[] rowMoney = new XSSFCellStyle[2];
    private final Map<MarginStyle, XSSFCellStyle[]> rowMargin = new EnumMap<>(MarginStyle.class);
    private final Map<MarginStyle, XSSFCellStyle> margin = new EnumMap<>(MarginStyle.class);

    WorkbookStyles(XSSFWorkbook workbook, String currencySymbol) {
        this.workbook = workbook;
        this.moneyFormat = workbook.createDataFormat().getFormat(moneyFormat(currencySymbol));
        this.percentFormat = workbook.createDataFormat().getFormat(PERCENT_FORMAT);

        title = workbook.createCellStyle();
        title.setFont(font(16, true, WHITE));
        fill(title, TITLE_FILL);
        title.setAlignment(HorizontalAlignment.CENTER);
        title.setVerticalAlignment(VerticalAlignment.CENTER);

        plainTitle = workbook.createCellStyle();
        plainTitle.setFont(font(16, true, null));
        plainTitle.setAlignment(HorizontalAlignment.CENTER);
        plainTitle.setVerticalAlignment(VerticalAlignment.CENTER);

        header = workbook.createCellStyle();
        header.setFont(font(11, true, WHITE));
        fill(header, HEADER_FILL);
        header.setAlignment(HorizontalAlignment.CENTER);
        header.setVerticalAlignment(VerticalAlignment.CENTER);
        header.setWrapText(true);
        border(header, BorderStyle.THIN, BorderStyle.THIN, null);

        plainHeader = workbook.createCellStyle();
        plainHeader.setFont(font(11, true, null));
        plainHeader.setAlignment(HorizontalAlignment.CENTER);

        for (int parity = 0; parity < 2; parity++) {
            String rowFill = parity == 0 ? EVEN_ROW_FILL : ODD_ROW_FILL;
            rowText[parity] = gridCell(rowFill, HorizontalAlignment.LEFT);
            rowMoney[parity] = gridCell(rowFill, HorizontalAlignment.RIGHT);
            rowMoney[parity].setDataFormat(moneyFormat);
        }
        for (MarginStyle sign : MarginStyle.values()) {
            XSSFCellStyle[] byParity = new XSSFCellStyle[2];
            for (int parity = 0; parity < 2; parity++) {
                byParity[parity] = gridCell(parity == 0 ? EVEN_ROW_FILL : ODD_ROW_FILL, HorizontalAlignment.RIGHT);
                byParity[parity].setDataFormat(percentFormat);
                byParity[parity].setFont(colouredFont(sign));
            }
            rowMargin.put(sign, byParity);

            XSSFCellStyle plain = workbook.createCellStyle();
            plain.setDataFormat(percentFormat);
            plain.setFont(colouredFont(sign));
            margin.put(sign, plain);
        }

        totalText = totalCell(HorizontalAlignment.LEFT);
        totalMoney = totalCell(HorizontalAlignment.RIGHT);
        totalMoney.setDataFormat(moneyFormat);
        totalPercent = totalCell(HorizontalAlignment.RIGHT);
        totalPercent.setDataFormat(percentFormat);

        summaryTitle = workbook.createCellStyle();
        summaryTitle.setFont(font(14, true, null));

        label = workbook.createCellStyle();
        label.setFont(font(11, true, null));

        money = workbook.createCellStyle();
        money.setDataFormat(moneyFormat);

        percent = workbook.createCellStyle();
        percent.setDataFormat(percentFormat);
    }

    static String moneyFormat(String currencySymbol) {
        return "\"" + currencySymbol + "\"#,##0.00";
    }

    XSSFCellStyle rowText(int rowIndex) {
        return rowText[rowIndex % 2];
    }

    XSSFCellStyle rowMoney(int rowIndex) {
        return rowMoney[rowIndex % 2];
    }

    XSSFCellStyle rowMargin(int rowIndex, double value) {
        return rowMargin.get(MarginStyle.forValue(value))[rowIndex % 2];
    }

    XSSFCellStyle margin(double value) {
        return margin.get(MarginStyle.forValue(value));
    }

    private XSSFCellStyle gridCell(String fillHex, HorizontalAlignment alignment) {
        XSSFCellStyle style = workbook.createCellStyle();
        fill(style, fillHex);
        style.setAlignment(alignment);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        border(style, BorderStyle.THIN, BorderStyle.THIN, GRID_BORDER);
        return style;
    }

    private XSSFCellStyle totalCell(HorizontalAlignment alignment) {
        XSSFCellStyle style = workbook.createCellStyle();
        style.setFont(font(12, true, null));
        fill(style, TOTAL_FILL);
        style.setAlignment(alignment);
        style.setVerticalAlignment(VerticalAlignment.CENTER);
        border(style, BorderStyle.DOUBLE, BorderStyle.THIN, null);
        return style;
    }

    private XSSFFont colouredFont(MarginStyle sign) {
        XSSFFont font = workbook.createFont();
        font.setColor(color(sign.getRgbHex()));
        return font;
    }

    private XSSFFont font(int heightInPoints, boolean bold, String colourHex) {
        XSSFFont font = workbook.createFont();
        font.setFontHeightInPoints((short) heightInPoints);
        font.setBold(bold);
        if (colourHex != null) {
            font.setColor(color(colourHex));
        }
        return font;
    }

    private static void fill(XSSFCellStyle style, String hex) {
        style.setFillForegroundColor(color(hex));
        style.setFillPattern(FillPatternType.SOLID_FOREGROUND);
    }

    // Top/bottom and left/right borders; a null colour keeps the default black
    private static void border(XSSFCellStyle style, BorderStyle horizontal, BorderStyle vertical, String colourHex) {
        style.setBorderTop(horizontal);
        style.setBorderBottom(horizontal);
        style.setBorderLeft(vertical);
        style.setBorderRight(vertical);
        if (colourHex != null) {
            XSSFColor c = color(colourHex);
            style.setTopBorderColor(c);
            style.setBottomBorderColor(c);
            style.setLeftBorderColor(c);
            style.setRightBorderColor(c);
        }
    }

    static XSSFColor color(String hex) {
        byte[] rgb = new byte[]{
                (byte) Integer.parseInt(hex.substring(0, 2), 16),
                (byte) Integer.parseInt(hex.substring(2, 4), 16),
                (byte) Integer.parseInt(hex.substring(4, 6), 16)
        };
        return new XSSFColor(rgb, null);
    }
}
