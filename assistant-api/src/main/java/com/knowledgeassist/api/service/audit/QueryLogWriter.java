package com.knowledgeassist.api.service.audit;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.knowledgeassist.api.model.QueryResponse;
import com.knowledgeassist.api.persistence.entity.QueryLogEntity;
import com.knowledgeassist.api.persistence.repository.QueryLogRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

@Component
public class QueryLogWriter {

    private static final Logger log = LoggerFactory.getLogger(QueryLogWriter.class);

    private final QueryLogRepository repository;
    private final ObjectMapper objectMapper;

    public QueryLogWriter(QueryLogRepository repository, ObjectMapper objectMapper) {
        this.repository = repository;
        this.objectMapper = objectMapper;
    }

    /**
     * @return id of the stored entry, empty when the write failed
     */
    public Optional<UUID> write(String tenantId,
                                String question,
                                QueryResponse response,
                                int retrievedChunksCount,
                                int llmTokensUsed) {
        QueryLogEntity entity = new QueryLogEntity();
        entity.setTenantId(tenantId);
        entity.setQuestion(question);
        entity.setAnswer(response.answer());
        entity.setSourcesJson(sourcesJson(response));
        entity.setConfidence(response.confidence());
        entity.setInsufficientContext(response.insufficientContext());
        entity.setRetrievedChunksCount(retrievedChunksCount);
        entity.setLlmTokensUsed(llmTokensUsed);
        entity.setProcessingTimeMs(response.processingTimeMs());
        entity.setServedFromCache(response.cached());
        try {
            return Optional.ofNullable(repository.save(entity).getId());
        } catch (RuntimeException ex) {
            log.warn("Failed to write query log for tenant {}: {}", tenantId, ex.getMessage());
            return Optional.empty();
        }
    }

    private String sourcesJson(QueryResponse response) {
        try {
            return objectMapper.writeValueAsString(response.sources());
        } catch (JsonProcessingException e) {
            log.debug("Query sources not serializable: {}", e.getOriginalMessage());
            return "[]";
        }
    }
}
