package com.knowledgeassist.api.service.tenant;

import com.knowledgeassist.api.persistence.entity.TenantEntity;
import com.knowledgeassist.api.persistence.repository.TenantRepository;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Optional;
import java.util.UUID;

/**
 * Resolves API keys to tenants. Only the SHA-256 of a key is ever stored or compared.
 */
@Service
public class TenantDirectory {

    private final TenantRepository repository;

    public TenantDirectory(TenantRepository repository) {
        this.repository = repository;
    }

    public Optional<TenantAccount> findByApiKey(String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            return Optional.empty();
        }
        return repository.findByApiKeyHash(hashApiKey(rawApiKey))
                .map(entity -> new TenantAccount(entity.getId(), entity.getName(), entity.isActive()));
    }

    /**
     * Registers a tenant unless one with the same key already exists.
     */
    public TenantAccount register(String name, String rawApiKey) {
        if (rawApiKey == null || rawApiKey.isBlank()) {
            throw new IllegalArgumentException("API key must not be blank");
        }
        String hash = hashApiKey(rawApiKey);
        TenantEntity entity = repository.findByApiKeyHash(hash)
                .orElseGet(() -> repository.save(new TenantEntity(UUID.randomUUID().toString(), name, hash, true)));
        return new TenantAccount(entity.getId(), entity.getName(), entity.isActive());
    }

    public static String hashApiKey(String rawApiKey) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(rawApiKey.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
