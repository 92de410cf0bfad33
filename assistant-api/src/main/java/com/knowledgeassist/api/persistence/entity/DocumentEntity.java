package com.knowledgeassist.api.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.PrePersist;
import jakarta.persistence.Table;

import java.time.OffsetDateTime;

@Entity
@Table(name = "documents", indexes = {
        @Index(name = "idx_documents_tenant", columnList = "tenant_id"),
        @Index(name = "idx_documents_tenant_name", columnList = "tenant_id,name")
})
public class DocumentEntity {

    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "tenant_id", nullable = false, updatable = false, length = 64)
    private String tenantId;

    @Column(name = "name", nullable = false, length = 500)
    private String name;

    @Column(name = "content", nullable = false, columnDefinition = "text")
    private String content;

    @Column(name = "content_type", length = 100)
    private String contentType;

    @Column(name = "chunk_count")
    private Integer chunkCount;

    @Column(name = "uploaded_at", nullable = false)
    private OffsetDateTime uploadedAt;

    protected DocumentEntity() {
    }

    public DocumentEntity(String id, String tenantId, String name, String content, String contentType) {
        this.id = id;
        this.tenantId = tenantId;
        this.name = name;
        this.content = content;
        this.contentType = contentType;
    }

    @PrePersist
    void onCreate() {
        if (uploadedAt == null) {
            uploadedAt = OffsetDateTime.now();
        }
    }

    public String getId() {
        return id;
    }

    public String getTenantId() {
        return tenantId;
    }

    public String getName() {
        return name;
    }

    public String getContent() {
        return content;
    }

    public String getContentType() {
        return contentType;
    }

    public Integer getChunkCount() {
        return chunkCount;
    }

    public void setChunkCount(Integer chunkCount) {
        this.chunkCount = chunkCount;
    }

    public OffsetDateTime getUploadedAt() {
        return uploadedAt;
    }
}
