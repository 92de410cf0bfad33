package com.knowledgeassist.api.service.ingestion;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.knowledgeassist.api.service.query.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;

import java.util.Comparator;
import java.util.List;

@Component
public class OpenAiEmbeddingsClient implements EmbeddingsClient {

    private static final Logger log = LoggerFactory.getLogger(OpenAiEmbeddingsClient.class);

    private final WebClient embeddingsWebClient;
    private final String model;
    private final int dimensions;

    public OpenAiEmbeddingsClient(@Qualifier("embeddingsWebClient") WebClient embeddingsWebClient,
                                  @Value("${assistant.embeddings.model:text-embedding-3-small}") String model,
                                  @Value("${assistant.qdrant.vector-size:1536}") int dimensions) {
        this.embeddingsWebClient = embeddingsWebClient;
        this.model = model;
        this.dimensions = dimensions;
    }

    @Override
    public EmbeddingBatch embed(List<String> texts) {
        if (texts == null || texts.isEmpty()) {
            throw new IllegalArgumentException("No texts provided for embedding");
        }
        EmbedResponse response;
        try {
            response = embeddingsWebClient.post()
                    .uri("/v1/embeddings")
                    .contentType(MediaType.APPLICATION_JSON)
                    .bodyValue(new EmbedRequest(model, texts))
                    .retrieve()
                    .bodyToMono(EmbedResponse.class)
                    .onErrorResume(throwable -> {
                        log.error("Embeddings call failed: {}", throwable.getMessage());
                        return Mono.error(new UpstreamFailureException("Failed to compute embeddings", throwable));
                    })
                    .block();
        } catch (UpstreamFailureException ex) {
            throw ex;
        } catch (Exception e) {
            throw new UpstreamFailureException("Failed to compute embeddings", e);
        }
        if (response == null || response.data() == null || response.data().size() != texts.size()) {
            throw new UpstreamFailureException("Embeddings service returned an unexpected number of vectors");
        }
        List<List<Double>> vectors = response.data().stream()
                .sorted(Comparator.comparingInt(EmbeddingData::index))
                .map(EmbeddingData::embedding)
                .toList();
        for (List<Double> vector : vectors) {
            if (vector == null || vector.size() != dimensions) {
                throw new UpstreamFailureException("Embedding dimension mismatch: expected " + dimensions);
            }
        }
        int promptTokens = response.usage() == null ? 0 : response.usage().promptTokens();
        return new EmbeddingBatch(vectors, response.model() == null ? model : response.model(), promptTokens);
    }

    private record EmbedRequest(String model, List<String> input) {}

    private record EmbedResponse(List<EmbeddingData> data, String model, Usage usage) {}

    private record EmbeddingData(int index, List<Double> embedding) {}

    private record Usage(@JsonProperty("prompt_tokens") int promptTokens) {}
}
