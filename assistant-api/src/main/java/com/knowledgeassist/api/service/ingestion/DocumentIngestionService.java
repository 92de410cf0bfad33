package com.knowledgeassist.api.service.ingestion;

import com.knowledgeassist.api.model.DocumentListItem;
import com.knowledgeassist.api.model.DocumentUploadResponse;

import java.util.List;

public interface DocumentIngestionService {

    DocumentUploadResponse ingestText(String tenantId, String name, String text, String contentType);

    /**
     * Ingests an uploaded file. The bytes are decoded as UTF-8.
     */
    DocumentUploadResponse ingestDocument(String tenantId, String filename, byte[] bytes, String contentType);

    List<DocumentListItem> listDocuments(String tenantId);
}
