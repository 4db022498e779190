package com.fleetbot.fleet_ledger.exception;

public class StorageException extends FleetLedgerException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
