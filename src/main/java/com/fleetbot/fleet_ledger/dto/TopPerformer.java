package com.fleetbot.fleet_ledger.dto;

import lombok.Value;

import java.math.BigDecimal;

@Value
public class TopPerformer {
    String vehicleNumber;
    String driverName;
    BigDecimal profit;
}
