package com.knowledgeassist.api.service.ingestion;

import com.knowledgeassist.api.model.DocumentListItem;
import com.knowledgeassist.api.model.DocumentUploadResponse;
import com.knowledgeassist.api.persistence.entity.DocumentEntity;
import com.knowledgeassist.api.persistence.repository.DocumentRepository;
import com.knowledgeassist.api.service.audit.AuditTrail;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import com.knowledgeassist.api.service.retrieval.IndexedFragment;
import com.knowledgeassist.api.service.retrieval.TenantPartitions;
import com.knowledgeassist.api.service.retrieval.VectorIndex;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Service
public class DefaultDocumentIngestionService implements DocumentIngestionService {

    private static final Logger log = LoggerFactory.getLogger(DefaultDocumentIngestionService.class);

    private static final String DEFAULT_CONTENT_TYPE = "text/plain";

    private final TextChunker textChunker;
    private final EmbeddingsClient embeddingsClient;
    private final VectorIndex vectorIndex;
    private final DocumentRepository documentRepository;
    private final AuditTrail auditTrail;
    private final MeterRegistry meterRegistry;
    private final Counter ingestionCounter;
    private final Counter rejectedCounter;
    private final Timer ingestionTimer;

    public DefaultDocumentIngestionService(TextChunker textChunker,
                                           EmbeddingsClient embeddingsClient,
                                           VectorIndex vectorIndex,
                                           DocumentRepository documentRepository,
                                           AuditTrail auditTrail,
                                           MeterRegistry meterRegistry) {
        this.textChunker = textChunker;
        this.embeddingsClient = embeddingsClient;
        this.vectorIndex = vectorIndex;
        this.documentRepository = documentRepository;
        this.auditTrail = auditTrail;
        this.meterRegistry = meterRegistry;
        this.ingestionCounter = meterRegistry.counter("assistant.ingest.events", "outcome", "accepted");
        this.rejectedCounter = meterRegistry.counter("assistant.ingest.events", "outcome", "rejected");
        this.ingestionTimer = meterRegistry.timer("assistant.ingest.duration");
    }

    @Override
    public DocumentUploadResponse ingestText(String tenantId, String name, String text, String contentType) {
        if (text == null || text.isBlank()) {
            rejectedCounter.increment();
            throw new DocumentRejectedException("Text payload must not be empty");
        }
        return ingestInternal(tenantId, name, text, contentType);
    }

    @Override
    public DocumentUploadResponse ingestDocument(String tenantId, String filename, byte[] bytes, String contentType) {
        if (bytes == null || bytes.length == 0) {
            rejectedCounter.increment();
            throw new DocumentRejectedException("Uploaded file is empty");
        }
        String text = decodeUtf8(bytes);
        if (text.isBlank()) {
            rejectedCounter.increment();
            throw new DocumentRejectedException("No text content found in " + filename);
        }
        return ingestInternal(tenantId, filename, text, contentType);
    }

    @Override
    public List<DocumentListItem> listDocuments(String tenantId) {
        return documentRepository.findByTenantIdOrderByUploadedAtDesc(tenantId).stream()
                .map(doc -> new DocumentListItem(doc.getId(), doc.getName(), doc.getContentType(), doc.getUploadedAt()))
                .toList();
    }

    private DocumentUploadResponse ingestInternal(String tenantId, String name, String text, String contentType) {
        if (tenantId == null || tenantId.isBlank()) {
            throw new DocumentRejectedException("Tenant ID is required");
        }
        if (name == null || name.isBlank()) {
            rejectedCounter.increment();
            throw new DocumentRejectedException("Document name is required");
        }
        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            DocumentUploadResponse response = ingestFresh(tenantId, name, text,
                    contentType == null || contentType.isBlank() ? DEFAULT_CONTENT_TYPE : contentType);
            ingestionCounter.increment();
            return response;
        } finally {
            sample.stop(ingestionTimer);
        }
    }

    private DocumentUploadResponse ingestFresh(String tenantId, String name, String text, String contentType) {
        String documentId = UUID.randomUUID().toString();
        DocumentEntity document = documentRepository.save(new DocumentEntity(documentId, tenantId, name, text, contentType));

        List<Chunk> chunks = textChunker.chunk(text);
        if (chunks.isEmpty()) {
            throw new DocumentRejectedException("No content chunks were produced for " + name);
        }
        List<String> texts = chunks.stream().map(Chunk::text).toList();
        EmbeddingsClient.EmbeddingBatch embeddings = embeddingsClient.embed(texts);
        if (embeddings.vectors().size() != chunks.size()) {
            throw new UpstreamFailureException("Embeddings response size did not match chunks");
        }

        List<IndexedFragment> fragments = new ArrayList<>(chunks.size());
        for (int i = 0; i < chunks.size(); i++) {
            Chunk chunk = chunks.get(i);
            fragments.add(new IndexedFragment(
                    UUID.randomUUID().toString(),
                    embeddings.vectors().get(i),
                    tenantId,
                    documentId,
                    name,
                    chunk.text(),
                    chunk.index(),
                    chunks.size(),
                    chunk.tokenCount()));
        }

        String partition = TenantPartitions.partitionFor(tenantId);
        vectorIndex.ensurePartition(partition);
        vectorIndex.upsert(partition, fragments);

        document.setChunkCount(chunks.size());
        documentRepository.save(document);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("name", name);
        metadata.put("chunks", chunks.size());
        auditTrail.record(tenantId, AuditTrail.ACTION_DOCUMENT_UPLOAD, "document", documentId, metadata);

        log.info("Ingested document {} for tenant {} into {} ({} chunks, model={})",
                documentId, tenantId, partition, chunks.size(), embeddings.model());
        return new DocumentUploadResponse(documentId, name, chunks.size(),
                "Document uploaded and processed successfully");
    }

    private String decodeUtf8(byte[] bytes) {
        try {
            return StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
        } catch (CharacterCodingException e) {
            rejectedCounter.increment();
            throw new DocumentRejectedException("Uploaded file is not valid UTF-8 text", e);
        }
    }
}
