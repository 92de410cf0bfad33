package com.knowledgeassist.api.service.audit;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeassist.api.persistence.entity.AuditLogEntity;
import com.knowledgeassist.api.persistence.repository.AuditLogRepository;
import com.knowledgeassist.api.service.query.TenantIsolationViolationException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AuditTrailTest {

    @Mock
    private AuditLogRepository repository;

    @Test
    void securityViolationIsWrittenWithFullContext() {
        AuditTrail auditTrail = new AuditTrail(repository, new ObjectMapper());
        TenantIsolationViolationException violation =
                new TenantIsolationViolationException("tenant-a", "tenant_tenanta_documents", "tenant-b");

        auditTrail.securityViolation("tenant-a", "What is the CEO salary?", violation);

        ArgumentCaptor<AuditLogEntity> captor = ArgumentCaptor.forClass(AuditLogEntity.class);
        verify(repository).save(captor.capture());
        AuditLogEntity entry = captor.getValue();
        assertThat(entry.getTenantId()).isEqualTo("tenant-a");
        assertThat(entry.getAction()).isEqualTo(AuditTrail.ACTION_SECURITY_VIOLATION);
        assertThat(entry.getMetadataJson())
                .contains("\"question\":\"What is the CEO salary?\"")
                .contains("\"observed_tenant_id\":\"tenant-b\"")
                .contains("tenant_tenanta_documents");
    }

    @Test
    void writeFailureIsNotPropagated() {
        when(repository.save(any(AuditLogEntity.class))).thenThrow(new DataAccessResourceFailureException("db down"));
        AuditTrail auditTrail = new AuditTrail(repository, new ObjectMapper());

        assertThatCode(() -> auditTrail.record("tenant-a", AuditTrail.ACTION_DOCUMENT_UPLOAD, "document", "d1",
                Map.of("name", "handbook.md"))).doesNotThrowAnyException();
    }
}
