package com.fleetbot.fleet_ledger.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "fleet")
public class FleetLedgerProperties {

    private Report report = new Report();
    private Trend trend = new Trend();

    @Data
    public static class Report {
        // Prefix used in the "R"#,##0.00 style money format
        private String currencySymbol = "R";
        private String creator = "Fleet Manager by Sheet Solved";
    }

    @Data
    public static class Trend {
        private int defaultWeeks = 4;
    }
}
