package com.fleetbot.fleet_ledger.exception;

public class NotFoundException extends FleetLedgerException {

    public NotFoundException(String message) {
        super(message);
    }

    public static NotFoundException vehicle(Object vehicleRef) {
        return new NotFoundException("Vehicle not found: " + vehicleRef);
    }

    public static NotFoundException entry(Long entryId) {
        return new NotFoundException("Weekly entry not found: " + entryId);
    }
}
