package com.knowledgeassist.api.service.query;

import com.knowledgeassist.api.model.QueryResponse;
import com.knowledgeassist.api.security.TenantPrincipal;

public interface KnowledgeQueryService {

    /**
     * Answers a question from the caller's own documents.
     *
     * @throws RateLimitExceededException          when the tenant exceeded its query budget for the current minute
     * @throws TenantIsolationViolationException   when retrieval surfaced a record owned by another tenant
     * @throws UpstreamFailureException            when an embedding, index, model or store call failed
     */
    QueryResponse query(TenantPrincipal tenant, String question);
}
