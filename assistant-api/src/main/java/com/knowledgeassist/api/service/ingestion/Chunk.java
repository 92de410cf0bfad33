package com.knowledgeassist.api.service.ingestion;

/**
 * A token-bounded slice of a document.
 *
 * @param text       decoded text, possibly trimmed back to a sentence boundary
 * @param index      0-based position within the document
 * @param tokenCount size of the untrimmed token window
 */
public record Chunk(String text, int index, int tokenCount) {
}
