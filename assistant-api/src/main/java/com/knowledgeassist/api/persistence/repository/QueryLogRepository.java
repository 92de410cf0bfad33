package com.knowledgeassist.api.persistence.repository;

import com.knowledgeassist.api.persistence.entity.QueryLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.UUID;

public interface QueryLogRepository extends JpaRepository<QueryLogEntity, UUID> {

    List<QueryLogEntity> findByTenantIdOrderByCreatedAtDesc(String tenantId);
}
