package com.knowledgeassist.api.service.retrieval;

import com.knowledgeassist.api.model.RetrievedFragment;

import java.util.List;

public interface FragmentRetriever {

    /**
     * @throws com.knowledgeassist.api.service.query.TenantIsolationViolationException when any hit belongs to
     *                                                                                 another tenant
     */
    List<RetrievedFragment> search(String tenantId, List<Double> queryVector, int topK, double scoreThreshold);
}
