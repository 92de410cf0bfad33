package com.knowledgeassist.api.service.retrieval;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientResponseException;

import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Qdrant over its REST API. One collection per tenant; the collection is the partition.
 */
@Component
public class QdrantVectorIndex implements VectorIndex {

    private static final Logger log = LoggerFactory.getLogger(QdrantVectorIndex.class);

    private final WebClient qdrantWebClient;
    private final int vectorSize;
    private final String distance;

    public QdrantVectorIndex(@Qualifier("qdrantWebClient") WebClient qdrantWebClient,
                             @Value("${assistant.qdrant.vector-size:1536}") int vectorSize,
                             @Value("${assistant.qdrant.distance:Cosine}") String distance) {
        this.qdrantWebClient = qdrantWebClient;
        this.vectorSize = vectorSize;
        this.distance = distance;
    }

    @Override
    public boolean partitionExists(String partition) {
        try {
            CollectionsResponse response = qdrantWebClient.get()
                    .uri("/collections")
                    .retrieve()
                    .bodyToMono(CollectionsResponse.class)
                    .block();
            return response != null && response.names().contains(partition);
        } catch (Exception e) {
            throw new UpstreamFailureException("Failed to list Qdrant collections", e);
        }
    }

    @Override
    public void ensurePartition(String partition) {
        if (partitionExists(partition)) {
            return;
        }
        try {
            qdrantWebClient.put()
                    .uri("/collections/{collection}", partition)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new CreateCollectionRequest(new VectorParams(vectorSize, distance)))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .block();
            qdrantWebClient.put()
                    .uri("/collections/{collection}/index", partition)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new CreateFieldIndexRequest(FragmentPayload.TENANT_ID, "keyword"))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .block();
            log.info("Created Qdrant collection {} ({} dimensions, {})", partition, vectorSize, distance);
        } catch (WebClientResponseException e) {
            if (e.getStatusCode().value() == HttpStatus.CONFLICT.value()) {
                log.debug("Collection {} was created concurrently", partition);
                return;
            }
            throw new UpstreamFailureException("Failed to create Qdrant collection " + partition, e);
        } catch (Exception e) {
            throw new UpstreamFailureException("Failed to create Qdrant collection " + partition, e);
        }
    }

    @Override
    public void upsert(String partition, List<IndexedFragment> fragments) {
        if (fragments == null || fragments.isEmpty()) {
            return;
        }
        List<Point> points = fragments.stream()
                .map(fragment -> new Point(fragment.pointId(), fragment.vector(), fragment.payload()))
                .toList();
        try {
            qdrantWebClient.put()
                    .uri(uriBuilder -> uriBuilder.path("/collections/{collection}/points")
                            .queryParam("wait", true)
                            .build(partition))
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new UpsertRequest(points))
                    .retrieve()
                    .bodyToMono(Void.class)
                    .block();
        } catch (Exception e) {
            log.error("Failed to upsert {} points into {}: {}", points.size(), partition, e.getMessage());
            throw new UpstreamFailureException("Failed to upsert into Qdrant", e);
        }
    }

    @Override
    public List<ScoredRecord> search(String partition,
                                     List<Double> vector,
                                     int limit,
                                     double scoreThreshold,
                                     String tenantId) {
        Filter filter = new Filter(List.of(new FieldCondition(FragmentPayload.TENANT_ID, new Match(tenantId))));
        SearchRequest request = new SearchRequest(vector, limit, scoreThreshold, filter, true);
        SearchResponse response;
        try {
            response = qdrantWebClient.post()
                    .uri("/collections/{collection}/points/search", partition)
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(request)
                    .retrieve()
                    .bodyToMono(SearchResponse.class)
                    .block();
        } catch (Exception e) {
            throw new UpstreamFailureException("Qdrant search failed", e);
        }
        return response == null ? Collections.emptyList() : response.toRecords();
    }

    @Override
    public boolean isAvailable() {
        try {
            qdrantWebClient.get()
                    .uri("/collections")
                    .retrieve()
                    .toBodilessEntity()
                    .block();
            return true;
        } catch (Exception e) {
            log.warn("Qdrant health probe failed: {}", e.getMessage());
            return false;
        }
    }

    private record CreateCollectionRequest(VectorParams vectors) {}

    private record VectorParams(int size, String distance) {}

    private record CreateFieldIndexRequest(@JsonProperty("field_name") String fieldName,
                                           @JsonProperty("field_schema") String fieldSchema) {}

    private record Point(String id, List<Double> vector, Map<String, Object> payload) {}

    private record UpsertRequest(List<Point> points) {}

    private record SearchRequest(List<Double> vector,
                                 int limit,
                                 @JsonProperty("score_threshold") double scoreThreshold,
                                 Filter filter,
                                 @JsonProperty("with_payload") boolean withPayload) {}

    private record Filter(List<FieldCondition> must) {}

    private record FieldCondition(String key, Match match) {}

    private record Match(String value) {}

    private record SearchResponse(List<Hit> result) {
        List<ScoredRecord> toRecords() {
            return result == null ? Collections.emptyList() : result.stream().map(Hit::toRecord).toList();
        }
    }

    private record Hit(Object id, double score, Map<String, Object> payload) {
        ScoredRecord toRecord() {
            return new ScoredRecord(id == null ? null : id.toString(), score, payload);
        }
    }

    private record CollectionsResponse(CollectionList result) {
        List<String> names() {
            if (result == null || result.collections() == null) {
                return List.of();
            }
            return result.collections().stream().map(CollectionDescription::name).toList();
        }
    }

    private record CollectionList(List<CollectionDescription> collections) {}

    private record CollectionDescription(String name) {}
}
