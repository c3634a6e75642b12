package com.metapharm.phi.infrastructure.audit;

/**
 * Resource types holding protected health information. Every create, read,
 * update and delete on these must produce an audit trail entry.
 */
public enum ProtectedResourceType {

    PATIENT_RECORD("patient_medical_record"),
    PRESCRIPTION("prescription"),
    PRESCRIPTION_ITEM("prescription_item"),
    TELECONSULTATION("teleconsultation"),
    CONSULTATION_NOTE("consultation_note"),
    TREATMENT_PLAN("treatment_plan"),
    PATIENT_PROFILE("patient_profile"),
    MEDICAL_HISTORY("medical_history"),
    ALLERGY_RECORD("allergy_record"),
    DIAGNOSIS("diagnosis"),
    LAB_RESULT("lab_result");

    private final String resourceType;

    ProtectedResourceType(String resourceType) {
        this.resourceType = resourceType;
    }

    /**
     * @return the value stored in {@code audit_trail_entries.resource_type}
     */
    public String getResourceType() {
        return resourceType;
    }

    /**
     * Event type for an action on this resource, e.g. {@code prescription.update}.
     */
    public String eventType(AuditAction action) {
        return resourceType + "." + action.name().toLowerCase(java.util.Locale.ROOT);
    }

    public static boolean isProtected(String resourceType) {
        for (ProtectedResourceType type : values()) {
            if (type.resourceType.equals(resourceType)) {
                return true;
            }
        }
        return false;
    }
}
