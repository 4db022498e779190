package com.fleetbot.fleet_ledger.exception;

import java.util.List;

/**
 * Raised for bad input before any derived computation or write happens.
 */
public class ValidationException extends FleetLedgerException {

    private final List<String> violations;

    public ValidationException(String message) {
        super(message);
        this.violations = List.of(message);
    }

    public ValidationException(List<String> violations) {
        super(String.join("; ", violations));
        this.violations = List.copyOf(violations);
    }

    public List<String> getViolations() {
        return violations;
    }
}
