package com.knowledgeassist.api.persistence.repository;

import com.knowledgeassist.api.persistence.entity.DocumentEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface DocumentRepository extends JpaRepository<DocumentEntity, String> {

    List<DocumentEntity> findByTenantIdOrderByUploadedAtDesc(String tenantId);
}
