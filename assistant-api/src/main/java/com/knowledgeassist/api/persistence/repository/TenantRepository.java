package com.knowledgeassist.api.persistence.repository;

import com.knowledgeassist.api.persistence.entity.TenantEntity;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.Optional;

public interface TenantRepository extends JpaRepository<TenantEntity, String> {

    Optional<TenantEntity> findByApiKeyHash(String apiKeyHash);
}
