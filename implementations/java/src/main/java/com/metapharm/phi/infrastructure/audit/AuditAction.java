package com.metapharm.phi.infrastructure.audit;

import java.util.Locale;

/**
 * CRUD action recorded on an audit trail entry.
 */
public enum AuditAction {

    CREATE("created"),
    READ("accessed"),
    UPDATE("updated"),
    DELETE("deleted");

    private final String pastTense;

    AuditAction(String pastTense) {
        this.pastTense = pastTense;
    }

    public String getPastTense() {
        return pastTense;
    }

    /**
     * Map an HTTP method to the action it performs on a resource.
     * Unknown or missing methods are treated as reads.
     */
    public static AuditAction fromHttpMethod(String method) {
        if (method == null) {
            return READ;
        }
        switch (method.toUpperCase(Locale.ROOT)) {
            case "POST":
                return CREATE;
            case "PUT":
            case "PATCH":
                return UPDATE;
            case "DELETE":
                return DELETE;
            default:
                return READ;
        }
    }
}
