package com.knowledgeassist.api.service.retrieval;

/**
 * Payload field names stored alongside every vector.
 */
public final class FragmentPayload {

    public static final String TENANT_ID = "tenant_id";
    public static final String DOCUMENT_ID = "document_id";
    public static final String DOCUMENT_NAME = "document_name";
    public static final String CHUNK_TEXT = "chunk_text";
    public static final String CHUNK_INDEX = "chunk_index";
    public static final String TOTAL_CHUNKS = "total_chunks";
    public static final String TOKEN_COUNT = "token_count";

    private FragmentPayload() {
    }
}
