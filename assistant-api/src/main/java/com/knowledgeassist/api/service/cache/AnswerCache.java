package com.knowledgeassist.api.service.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import com.knowledgeassist.api.service.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Duration;
import java.util.Collection;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeSet;

/**
 * Answers keyed by tenant, question and the set of documents that contributed context. Entries are never
 * invalidated when a document changes; they age out by TTL. An unreachable store reads as a miss and skips the write.
 */
@Component
public class AnswerCache {

    private static final Logger log = LoggerFactory.getLogger(AnswerCache.class);

    static final String KEY_PREFIX = "cache:llm:";
    private static final String DELIMITER = ":";

    private final KeyValueStore store;
    private final CacheAdmissionPolicy admissionPolicy;
    private final ObjectMapper objectMapper;
    private final Duration defaultTtl;

    public AnswerCache(KeyValueStore store,
                       CacheAdmissionPolicy admissionPolicy,
                       ObjectMapper objectMapper,
                       @Value("${assistant.cache.ttl-seconds:3600}") long ttlSeconds) {
        this.store = store;
        this.admissionPolicy = admissionPolicy;
        this.objectMapper = objectMapper;
        this.defaultTtl = Duration.ofSeconds(Math.max(1, ttlSeconds));
    }

    public String key(String tenantId, String question, Collection<String> documentIds) {
        TreeSet<String> sorted = new TreeSet<>();
        if (documentIds != null) {
            documentIds.stream().filter(Objects::nonNull).forEach(sorted::add);
        }
        String content = tenantId + DELIMITER + question + DELIMITER + String.join(DELIMITER, sorted);
        return KEY_PREFIX + sha256(content);
    }

    public Optional<CachedAnswer> get(String tenantId, String question, Collection<String> documentIds) {
        String key = key(tenantId, question, documentIds);
        Optional<String> raw;
        try {
            raw = store.get(key);
        } catch (UpstreamFailureException | DataAccessException e) {
            log.warn("Cache read failed for tenant {}; treating as miss: {}", tenantId, e.getMessage());
            return Optional.empty();
        }
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(objectMapper.readValue(raw.get(), CachedAnswer.class));
        } catch (JsonProcessingException e) {
            log.warn("Ignoring unreadable cache entry {}: {}", key, e.getOriginalMessage());
            return Optional.empty();
        }
    }

    public boolean put(String tenantId, String question, Collection<String> documentIds, CachedAnswer answer) {
        return put(tenantId, question, documentIds, answer, null);
    }

    /**
     * Stores the answer when the admission policy allows it.
     *
     * @param ttl expiry for this entry, or {@code null} for the configured default
     * @return whether the answer was stored
     */
    public boolean put(String tenantId,
                       String question,
                       Collection<String> documentIds,
                       CachedAnswer answer,
                       Duration ttl) {
        Optional<String> rejection = admissionPolicy.rejectionReason(question, answer);
        if (rejection.isPresent()) {
            log.debug("Answer for tenant {} not cached: {}", tenantId, rejection.get());
            return false;
        }
        String value;
        try {
            value = objectMapper.writeValueAsString(answer);
        } catch (JsonProcessingException e) {
            log.warn("Failed to serialize answer for tenant {}; skipping cache", tenantId, e);
            return false;
        }
        Duration effectiveTtl = ttl == null || ttl.isZero() || ttl.isNegative() ? defaultTtl : ttl;
        try {
            store.set(key(tenantId, question, documentIds), value, effectiveTtl);
        } catch (UpstreamFailureException | DataAccessException e) {
            log.warn("Cache write failed for tenant {}; answer not cached: {}", tenantId, e.getMessage());
            return false;
        }
        return true;
    }

    private String sha256(String text) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] hash = digest.digest(text.getBytes(StandardCharsets.UTF_8));
            StringBuilder builder = new StringBuilder();
            for (byte b : hash) {
                builder.append(String.format("%02x", b));
            }
            return builder.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 is not available", e);
        }
    }
}
