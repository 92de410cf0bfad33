package com.knowledgeassist.api.model;

public record RetrievedFragment(
        String documentId,
        String documentName,
        String chunkText,
        int chunkIndex,
        double score
) {
}
