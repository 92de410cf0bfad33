package com.knowledgeassist.api.service.retrieval;

import com.knowledgeassist.api.model.RetrievedFragment;
import com.knowledgeassist.api.service.query.TenantIsolationViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;

@Service
public class TenantIsolatedRetriever implements FragmentRetriever {

    private static final Logger log = LoggerFactory.getLogger(TenantIsolatedRetriever.class);

    private final VectorIndex vectorIndex;

    public TenantIsolatedRetriever(VectorIndex vectorIndex) {
        this.vectorIndex = vectorIndex;
    }

    @Override
    public List<RetrievedFragment> search(String tenantId, List<Double> queryVector, int topK, double scoreThreshold) {
        String partition = TenantPartitions.partitionFor(tenantId);
        if (!vectorIndex.partitionExists(partition)) {
            log.debug("Partition {} does not exist yet; tenant {} has no indexed documents", partition, tenantId);
            return List.of();
        }
        List<ScoredRecord> records = vectorIndex.search(partition, queryVector, topK, scoreThreshold, tenantId);

        // Every record is checked before any result is built.
        for (ScoredRecord record : records) {
            Object stored = record.payload().get(FragmentPayload.TENANT_ID);
            if (stored == null || !tenantId.equals(stored.toString())) {
                throw new TenantIsolationViolationException(tenantId, partition, stored == null ? null : stored.toString());
            }
        }

        List<RetrievedFragment> fragments = new ArrayList<>(records.size());
        for (ScoredRecord record : records) {
            fragments.add(toFragment(record));
        }
        // List.sort is stable, so equal scores keep the index's order.
        fragments.sort(Comparator.comparingDouble(RetrievedFragment::score).reversed());
        return List.copyOf(fragments);
    }

    private RetrievedFragment toFragment(ScoredRecord record) {
        Map<String, Object> payload = record.payload();
        return new RetrievedFragment(
                asString(payload.get(FragmentPayload.DOCUMENT_ID)),
                asString(payload.get(FragmentPayload.DOCUMENT_NAME)),
                asString(payload.get(FragmentPayload.CHUNK_TEXT)),
                asInt(payload.get(FragmentPayload.CHUNK_INDEX)),
                record.score()
        );
    }

    private String asString(Object value) {
        return value == null ? "" : value.toString();
    }

    private int asInt(Object value) {
        if (value instanceof Number number) {
            return number.intValue();
        }
        if (value == null) {
            return 0;
        }
        try {
            return Integer.parseInt(value.toString());
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
