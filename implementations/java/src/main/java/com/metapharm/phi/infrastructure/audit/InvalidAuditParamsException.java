package com.metapharm.phi.infrastructure.audit;

import java.util.List;

/**
 * An audit event was missing one or more required fields. Nothing was written.
 */
public class InvalidAuditParamsException extends IllegalArgumentException {

    private final List<String> missingFields;

    public InvalidAuditParamsException(List<String> missingFields) {
        super("Audit event requires " + String.join(", ", missingFields));
        this.missingFields = List.copyOf(missingFields);
    }

    public List<String> getMissingFields() {
        return missingFields;
    }
}
