package com.metapharm.phi.application;

import com.metapharm.phi.infrastructure.audit.AuditChanges;
import com.metapharm.phi.infrastructure.audit.AuditEventParams;
import com.metapharm.phi.infrastructure.audit.AuditTrailEntry;
import com.metapharm.phi.infrastructure.audit.AuditTrailService;
import com.metapharm.phi.infrastructure.audit.FieldChange;
import com.metapharm.phi.infrastructure.crypto.FieldBatchResult;
import com.metapharm.phi.infrastructure.crypto.FieldCipher;
import com.metapharm.phi.infrastructure.crypto.key.DataKeyCache;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point used by the platform services for PHI columns and audit events.
 *
 * <p>Thin by intent: every call delegates to the cipher, the data key cache or
 * the audit trail. Errors propagate unchanged.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PhiApplicationService {

    private final FieldCipher fieldCipher;
    private final DataKeyCache dataKeyCache;
    private final AuditTrailService auditTrailService;

    public byte[] encryptField(String plaintext) {
        return fieldCipher.encrypt(plaintext);
    }

    public String decryptField(byte[] envelope) {
        return fieldCipher.decrypt(envelope);
    }

    public FieldBatchResult<byte[]> encryptFields(Map<String, String> fields) {
        return fieldCipher.encryptFields(fields);
    }

    public FieldBatchResult<String> decryptFields(Map<String, byte[]> fields) {
        return fieldCipher.decryptFields(fields);
    }

    /**
     * Drop every cached data key, e.g. after a master key rotation.
     */
    public void clearDataKeyCache() {
        log.info("Clearing data key cache on request");
        dataKeyCache.clear();
    }

    public long getDataKeyCacheSize() {
        return dataKeyCache.size();
    }

    public Optional<AuditTrailEntry> logAuditEvent(AuditEventParams params) {
        return auditTrailService.record(params);
    }

    public Optional<AuditTrailEntry> logAuditEventFromRequest(HttpServletRequest request, AuditEventParams params) {
        return auditTrailService.recordFromRequest(request, params);
    }

    public Map<String, FieldChange> createChangesObject(Map<String, ?> oldRecord,
                                                        Map<String, ?> newRecord,
                                                        Collection<String> fields) {
        return AuditChanges.diff(oldRecord, newRecord, fields);
    }
}
