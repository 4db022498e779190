package com.fleetbot.fleet_ledger.exception;

// Reserved for optimistic locking on ledger entries. Upserts are last-writer-wins today.
public class ConflictException extends FleetLedgerException {

    public ConflictException(String message) {
        super(message);
    }
}
