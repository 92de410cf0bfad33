package com.knowledgeassist.api.service.retrieval;

import java.util.Map;

/**
 * A raw nearest-neighbour hit, payload exactly as the index stored it.
 */
public record ScoredRecord(String id, double score, Map<String, Object> payload) {

    public ScoredRecord {
        payload = payload == null ? Map.of() : payload;
    }
}
