package com.knowledgeassist.api.service.retrieval;

import java.util.List;

public interface VectorIndex {

    boolean partitionExists(String partition);

    /**
     * Creates the partition and its tenant payload index when missing. Safe to call concurrently.
     */
    void ensurePartition(String partition);

    void upsert(String partition, List<IndexedFragment> fragments);

    /**
     * Nearest neighbours restricted to records whose stored tenant id equals {@code tenantId}.
     */
    List<ScoredRecord> search(String partition, List<Double> vector, int limit, double scoreThreshold, String tenantId);

    boolean isAvailable();
}
