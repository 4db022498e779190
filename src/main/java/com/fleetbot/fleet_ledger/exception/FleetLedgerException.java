package com.fleetbot.fleet_ledger.exception;

/**
 * Base type for every error the ledger engine reports to its callers.
 */
public abstract class FleetLedgerException extends RuntimeException {

    protected FleetLedgerException(String message) {
        super(message);
    }

    protected FleetLedgerException(String message, Throwable cause) {
        super(message, cause);
    }
}
