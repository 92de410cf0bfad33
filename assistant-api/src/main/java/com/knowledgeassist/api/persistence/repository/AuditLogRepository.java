package com.knowledgeassist.api.persistence.repository;

import com.knowledgeassist.api.persistence.entity.AuditLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface AuditLogRepository extends JpaRepository<AuditLogEntity, UUID> {

    List<AuditLogEntity> findByTenantIdAndActionOrderByCreatedAtDesc(String tenantId, String action);
}
