package com.knowledgeassist.api.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeassist.api.persistence.entity.AuditLogEntity;
import com.knowledgeassist.api.persistence.repository.AuditLogRepository;
import com.knowledgeassist.api.service.query.TenantIsolationViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only record of tenant actions. Writes are best-effort: a failed write is logged and never reaches the
 * caller, with the exception of the {@code SECURITY_AUDIT} log line which is always emitted.
 */
@Component
public class AuditTrail {

    private static final Logger log = LoggerFactory.getLogger(AuditTrail.class);

    public static final String ACTION_DOCUMENT_UPLOAD = "document_upload";
    public static final String ACTION_QUERY_EXECUTE = "query_execute";
    public static final String ACTION_SECURITY_VIOLATION = "security_violation";

    private final AuditLogRepository repository;
    private final ObjectMapper objectMapper;

    public AuditTrail(AuditLogRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    public void record(String tenantId,
                       String action,
                       String resourceType,
                       String resourceId,
                       Map<String, Object> metadata) {
        try {
            repository.save(new AuditLogEntity(tenantId, action, resourceType, resourceId, toJson(metadata)));
        } catch (RuntimeException ex) {
            log.warn("Failed to write audit entry action={} tenant={}: {}", action, tenantId, ex.getMessage());
        }
    }

    public void securityViolation(String tenantId, String question, TenantIsolationViolationException violation) {
        log.error("SECURITY_AUDIT tenant={} question={} partition={} observedTenant={} detail={}",
                tenantId,
                question,
                violation.partition(),
                violation.observedTenantId(),
                violation.getMessage());
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("question", question);
        metadata.put("partition", violation.partition());
        metadata.put("observed_tenant_id", violation.observedTenantId());
        metadata.put("detail", violation.getMessage());
        record(tenantId, ACTION_SECURITY_VIOLATION, "query", null, metadata);
    }

    private String toJson(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(metadata);
        } catch (JsonProcessingException e) {
            log.debug("Audit metadata not serializable: {}", e.getOriginalMessage());
            return String.valueOf(metadata);
        }
    }
}
