package com.knowledgeassist.api.model;

public record DocumentUploadResponse(String documentId,
                                     String name,
                                     int chunksCount,
                                     String message) {
}
