package com.metapharm.phi.infrastructure.audit;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AuditChangesTest {

    @Test
    void testOnlyModifiedFieldsAreReported() {
        Map<String, Object> before = new HashMap<>();
        before.put("status", "pending");
        before.put("approved_at", null);
        before.put("pharmacist_id", null);
        before.put("notes", "none");

        Map<String, Object> after = new HashMap<>(before);
        after.put("status", "approved");
        after.put("approved_at", Instant.parse("2025-11-07T10:00:00Z"));
        after.put("pharmacist_id", "123e4567");

        Map<String, FieldChange> changes = AuditChanges.diff(before, after,
            List.of("status", "approved_at", "pharmacist_id", "notes"));

        assertThat(changes).containsOnlyKeys("status", "approved_at", "pharmacist_id");
        assertThat(changes.get("status")).isEqualTo(new FieldChange("pending", "approved"));
        assertThat(changes.get("pharmacist_id").getOldValue()).isNull();
    }

    @Test
    void testNoChangesReturnsNull() {
        Map<String, Object> snapshot = Map.of("status", "pending");

        assertThat(AuditChanges.diff(snapshot, Map.of("status", "pending"), List.of("status"))).isNull();
    }

    @Test
    void testStructurallyEqualValuesAreUnchanged() {
        Map<String, Object> before = Map.of("tags", new String[] {"a", "b"}, "dose", List.of(1, 2));
        Map<String, Object> after = Map.of("tags", new String[] {"a", "b"}, "dose", List.of(1, 2));

        assertThat(AuditChanges.diff(before, after, List.of("tags", "dose"))).isNull();
    }

    @Test
    void testFieldsOutsideTheListAreIgnored() {
        Map<String, FieldChange> changes = AuditChanges.diff(
            Map.of("status", "a", "secret", "x"),
            Map.of("status", "b", "secret", "y"),
            List.of("status"));

        assertThat(changes).containsOnlyKeys("status");
    }
}
