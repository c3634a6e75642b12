package com.metapharm.phi.infrastructure.audit;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@code changes} payload of an UPDATE audit entry.
 */
public final class AuditChanges {

    private AuditChanges() {
    }

    /**
     * Compare the listed fields of two snapshots of the same record.
     *
     * <p>Values are compared structurally ({@link Objects#deepEquals}), so arrays
     * with the same content count as unchanged. A field missing from a snapshot
     * is treated as null.
     *
     * @return changed fields in the order given, or null if nothing changed
     */
    public static Map<String, FieldChange> diff(Map<String, ?> oldRecord,
                                                Map<String, ?> newRecord,
                                                Collection<String> fields) {
        Map<String, ?> before = oldRecord == null ? Collections.emptyMap() : oldRecord;
        Map<String, ?> after = newRecord == null ? Collections.emptyMap() : newRecord;

        Map<String, FieldChange> changes = new LinkedHashMap<>();
        for (String field : fields) {
            Object oldValue = before.get(field);
            Object newValue = after.get(field);
            if (!Objects.deepEquals(oldValue, newValue)) {
                changes.put(field, new FieldChange(oldValue, newValue));
            }
        }
        return changes.isEmpty() ? null : changes;
    }
}
