package com.knowledgeassist.api.service.ingestion;

import java.util.List;

public interface EmbeddingsClient {

    /**
     * One vector per input text, in input order.
     */
    EmbeddingBatch embed(List<String> texts);

    default List<Double> embed(String text) {
        return embed(List.of(text)).vectors().get(0);
    }

    record EmbeddingBatch(List<List<Double>> vectors, String model, int promptTokens) {}
}
