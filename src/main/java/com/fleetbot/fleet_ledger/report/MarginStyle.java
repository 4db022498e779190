package com.fleetbot.fleet_ledger.report;

/**
 * Colour coding for profit margin cells, keyed only on the sign of the value.
 */
public enum MarginStyle {
    NON_NEGATIVE("27AE60"),
    NEGATIVE("E74C3C");

    private final String rgbHex;

    MarginStyle(String rgbHex) {
        this.rgbHex = rgbHex;
    }

    public static MarginStyle forValue(double margin) {
        return margin < 0 ? NEGATIVE : NON_NEGATIVE;
    }

    public String getRgbHex() {
        return rgbHex;
    }
}
