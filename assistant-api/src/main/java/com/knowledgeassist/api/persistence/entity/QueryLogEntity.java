package com.knowledgeassist.api.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;
import java.util.UUID;

@Entity
@Table(name = "queries", indexes = @Index(name = "idx_queries_tenant_created", columnList = "tenant_id,created_at"))
public class QueryLogEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private UUID id;

    @Column(name = "tenant_id", nullable = false, length = 64)
    private String tenantId;

    @Column(name = "question", nullable = false, columnDefinition = "text")
    private String question;

    @Column(name = "answer", columnDefinition = "text")
    private String answer;

    @Column(name = "sources", columnDefinition = "text")
    private String sourcesJson;

    @Column(name = "confidence")
    private Double confidence;

    @Column(name = "insufficient_context", nullable = false)
    private boolean insufficientContext;

    @Column(name = "retrieved_chunks_count", nullable = false)
    private int retrievedChunksCount;

    @Column(name = "llm_tokens_used", nullable = false)
    private int llmTokensUsed;

    @Column(name = "processing_time_ms", nullable = false)
    private long processingTimeMs;

    @Column(name = "served_from_cache", nullable = false)
    private boolean servedFromCache;

    @Column(name = "created_at", nullable = false)
    private OffsetDateTime createdAt;

    @PrePersist
    void onCreate() {
        if (createdAt == null) {
            createdAt = OffsetDateTime.now();
        }
    }

    public UUID getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getQuestion() {
        return question;
    }

    public void setQuestion(String question) {
        this.question = question;
    }

    public String getAnswer() {
        return answer;
    }

    public void setAnswer(String answer) {
        this.answer = answer;
    }

    public String getSourcesJson() {
        return sourcesJson;
    }

    public void setSourcesJson(String sourcesJson) {
        this.sourcesJson = sourcesJson;
    }

    public Double getConfidence() {
        return confidence;
    }

    public void setConfidence(Double confidence) {
        this.confidence = confidence;
    }

    public boolean isInsufficientContext() {
        return insufficientContext;
    }

    public void setInsufficientContext(boolean insufficientContext) {
        this.insufficientContext = insufficientContext;
    }

    public int getRetrievedChunksCount() {
        return retrievedChunksCount;
    }

    public void setRetrievedChunksCount(int retrievedChunksCount) {
        this.retrievedChunksCount = retrievedChunksCount;
    }

    public int getLlmTokensUsed() {
        return llmTokensUsed;
    }

    public void setLlmTokensUsed(int llmTokensUsed) {
        this.llmTokensUsed = llmTokensUsed;
    }

    public long getProcessingTimeMs() {
        return processingTimeMs;
    }

    public void setProcessingTimeMs(long processingTimeMs) {
        this.processingTimeMs = processingTimeMs;
    }

    public boolean isServedFromCache() {
        return servedFromCache;
    }

    public void setServedFromCache(boolean servedFromCache) {
        this.servedFromCache = servedFromCache;
    }

    public OffsetDateTime getCreatedAt() {
        return createdAt;
    }
}
