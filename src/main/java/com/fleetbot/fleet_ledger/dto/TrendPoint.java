package com.fleetbot.fleet_ledger.dto;

import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

@Value
public class TrendPoint {
    LocalDate week;
    BigDecimal revenue;
    BigDecimal profit;
    BigDecimal deductions;
    double profitMargin;
}
