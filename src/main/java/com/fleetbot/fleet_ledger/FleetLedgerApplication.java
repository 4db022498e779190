package com.fleetbot.fleet_ledger;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Weekly fleet ledger: per-vehicle weekly P&L, fleet dashboards and spreadsheet reports,
 * served through a Telegram bot.
 */
@Slf4j
@SpringBootApplication
@ConfigurationPropertiesScan
public class FleetLedgerApplication {

    public static void main(String[] args) {
        log.info("Starting Fleet Ledger...");
        SpringApplication.run(FleetLedgerApplication.class, args);
    }
}
