package com.knowledgeassist.api.service.retrieval;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

public record IndexedFragment(String pointId,
                              List<Double> vector,
                              String tenantId,
                              String documentId,
                              String documentName,
                              String chunkText,
                              int chunkIndex,
                              int totalChunks,
                              int tokenCount) {

    public Map<String, Object> payload() {
        Map<String, Object> payload = new HashMap<>();
        payload.put(FragmentPayload.TENANT_ID, tenantId);
        payload.put(FragmentPayload.DOCUMENT_ID, documentId);
        payload.put(FragmentPayload.DOCUMENT_NAME, documentName);
        payload.put(FragmentPayload.CHUNK_TEXT, chunkText);
        payload.put(FragmentPayload.CHUNK_INDEX, chunkIndex);
        payload.put(FragmentPayload.TOTAL_CHUNKS, totalChunks);
        payload.put(FragmentPayload.TOKEN_COUNT, tokenCount);
        return payload;
    }
}
