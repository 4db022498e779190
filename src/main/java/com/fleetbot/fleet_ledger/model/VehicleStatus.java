package com.fleetbot.fleet_ledger.model;

public enum VehicleStatus {
    ACTIVE,
    INACTIVE,
    MAINTENANCE
}
