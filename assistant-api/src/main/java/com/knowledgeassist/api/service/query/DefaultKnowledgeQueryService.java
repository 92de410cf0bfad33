package com.knowledgeassist.api.service.query;

import com.knowledgeassist.api.model.QueryResponse;
import com.knowledgeassist.api.model.RetrievedFragment;
import com.knowledgeassist.api.security.TenantPrincipal;
import com.knowledgeassist.api.service.audit.AuditTrail;
import com.knowledgeassist.api.service.audit.QueryLogWriter;
import com.knowledgeassist.api.service.cache.AnswerCache;
import com.knowledgeassist.api.service.cache.CachedAnswer;
import com.knowledgeassist.api.service.ingestion.EmbeddingsClient;
import com.knowledgeassist.api.service.ratelimit.RateLimiter;
import com.knowledgeassist.api.service.retrieval.FragmentRetriever;
import com.knowledgeassist.api.service.synthesis.AnswerSynthesizer;
import com.knowledgeassist.api.service.synthesis.SynthesizedAnswer;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

@Service
public class DefaultKnowledgeQueryService implements KnowledgeQueryService {

    private static final Logger log = LoggerFactory.getLogger(DefaultKnowledgeQueryService.class);

    static final String OPERATION = "query";

    private final RateLimiter rateLimiter;
    private final EmbeddingsClient embeddingsClient;
    private final FragmentRetriever retriever;
    private final AnswerCache answerCache;
    private final AnswerSynthesizer synthesizer;
    private final AuditTrail auditTrail;
    private final QueryLogWriter queryLogWriter;
    private final MeterRegistry meterRegistry;
    private final Clock clock;
    private final int topK;
    private final double similarityThreshold;
    private final Timer queryTimer;
    private final Counter answeredCounter;
    private final Counter cacheHitCounter;
    private final Counter insufficientCounter;
    private final Counter throttledCounter;
    private final Counter violationCounter;

    public DefaultKnowledgeQueryService(RateLimiter rateLimiter,
                                        EmbeddingsClient embeddingsClient,
                                        FragmentRetriever retriever,
                                        AnswerCache answerCache,
                                        AnswerSynthesizer synthesizer,
                                        AuditTrail auditTrail,
                                        QueryLogWriter queryLogWriter,
                                        MeterRegistry meterRegistry,
                                        Clock clock,
                                        @Value("${assistant.rag.top-k:5}") int topK,
                                        @Value("${assistant.rag.similarity-threshold:0.7}") double similarityThreshold) {
        this.rateLimiter = rateLimiter;
        this.embeddingsClient = embeddingsClient;
        this.retriever = retriever;
        this.answerCache = answerCache;
        this.synthesizer = synthesizer;
        this.auditTrail = auditTrail;
        this.queryLogWriter = queryLogWriter;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        this.topK = topK;
        this.similarityThreshold = similarityThreshold;
        this.queryTimer = meterRegistry.timer("assistant.query.duration");
        this.answeredCounter = meterRegistry.counter("assistant.query.events", "outcome", "answered");
        this.cacheHitCounter = meterRegistry.counter("assistant.query.events", "outcome", "cache_hit");
        this.insufficientCounter = meterRegistry.counter("assistant.query.events", "outcome", "insufficient_context");
        this.throttledCounter = meterRegistry.counter("assistant.query.events", "outcome", "throttled");
        this.violationCounter = meterRegistry.counter("assistant.query.events", "outcome", "security_violation");
    }

    @Override
    public QueryResponse query(TenantPrincipal tenant, String question) {
        long startedAt = clock.millis();
        String tenantId = tenant.tenantId();

        if (!rateLimiter.allow(tenantId, OPERATION)) {
            throttledCounter.increment();
            log.info("Query throttled for tenant {}", tenantId);
            throw new RateLimitExceededException(rateLimiter.limitPerMinute());
        }

        Timer.Sample sample = Timer.start(meterRegistry);
        try {
            List<Double> queryVector = embeddingsClient.embed(question);
            List<RetrievedFragment> fragments = retrieve(tenantId, question, queryVector);

            if (fragments.isEmpty()) {
                insufficientCounter.increment();
                QueryResponse response = new QueryResponse(null, List.of(), 0.0, true, elapsed(startedAt), false);
                complete(tenantId, question, response, 0, 0);
                return response;
            }

            List<String> documentIds = fragments.stream().map(RetrievedFragment::documentId).toList();
            Optional<CachedAnswer> cached = answerCache.get(tenantId, question, documentIds);
            if (cached.isPresent()) {
                cacheHitCounter.increment();
                CachedAnswer hit = cached.get();
                log.debug("Serving cached answer for tenant {}", tenantId);
                QueryResponse response = new QueryResponse(hit.answer(), hit.sources(), hit.confidence(),
                        hit.insufficientContext(), elapsed(startedAt), true);
                complete(tenantId, question, response, fragments.size(), 0);
                return response;
            }

            SynthesizedAnswer answer = synthesizer.synthesize(question, fragments, tenant.tenantName());
            answerCache.put(tenantId, question, documentIds, answer.toCachedAnswer());
            if (answer.insufficientContext()) {
                insufficientCounter.increment();
            } else {
                answeredCounter.increment();
            }
            QueryResponse response = new QueryResponse(answer.answer(), answer.sources(), answer.confidence(),
                    answer.insufficientContext(), elapsed(startedAt), false);
            complete(tenantId, question, response, fragments.size(), answer.tokenUsage().total());
            return response;
        } finally {
            sample.stop(queryTimer);
        }
    }

    private List<RetrievedFragment> retrieve(String tenantId, String question, List<Double> queryVector) {
        try {
            return retriever.search(tenantId, queryVector, topK, similarityThreshold);
        } catch (TenantIsolationViolationException violation) {
            violationCounter.increment();
            auditTrail.securityViolation(tenantId, question, violation);
            throw violation;
        }
    }

    private void complete(String tenantId, String question, QueryResponse response, int retrieved, int tokensUsed) {
        Optional<UUID> queryId = queryLogWriter.write(tenantId, question, response, retrieved, tokensUsed);
        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("question_length", question.length());
        metadata.put("confidence", response.confidence());
        metadata.put("insufficient_context", response.insufficientContext());
        metadata.put("cached", response.cached());
        auditTrail.record(tenantId, AuditTrail.ACTION_QUERY_EXECUTE, "query",
                queryId.map(String::valueOf).orElse(null), metadata);
    }

    private long elapsed(long startedAt) {
        return Math.max(0, clock.millis() - startedAt);
    }
}
