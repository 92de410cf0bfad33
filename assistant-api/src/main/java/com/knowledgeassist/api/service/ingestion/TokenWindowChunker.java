package com.knowledgeassist.api.service.ingestion;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class TokenWindowChunker implements TextChunker {

    private static final double SENTENCE_BOUNDARY_FLOOR = 0.7;

    private final Tokenizer tokenizer;
    private final int chunkSize;
    private final int overlap;

    public TokenWindowChunker(Tokenizer tokenizer,
                              @Value("${assistant.rag.chunk-size:500}") int chunkSize,
                              @Value("${assistant.rag.chunk-overlap:50}") int overlap) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive");
        }
        if (overlap < 0 || overlap >= chunkSize) {
            throw new IllegalArgumentException("Chunk overlap must be in [0, chunk size)");
        }
        this.tokenizer = tokenizer;
        this.chunkSize = chunkSize;
        this.overlap = overlap;
    }

    @Override
    public List<Chunk> chunk(String text) {
        if (text == null || text.isEmpty()) {
            return List.of();
        }
        List<Integer> tokens = tokenizer.encode(text);
        if (tokens.isEmpty()) {
            return List.of();
        }
        int stride = chunkSize - overlap;
        List<Chunk> chunks = new ArrayList<>();
        for (int start = 0; start < tokens.size(); start += stride) {
            int end = Math.min(start + chunkSize, tokens.size());
            List<Integer> window = tokens.subList(start, end);
            String chunkText = tokenizer.decode(window);
            boolean last = end >= tokens.size();
            if (!last) {
                chunkText = trimToSentence(chunkText);
            }
            chunks.add(new Chunk(chunkText, chunks.size(), window.size()));
            if (last) {
                break;
            }
        }
        return List.copyOf(chunks);
    }

    // Only cut back when the last period falls in the final 30% of the window.
    private String trimToSentence(String chunkText) {
        int lastPeriod = chunkText.lastIndexOf('.');
        if (lastPeriod >= 0 && lastPeriod >= chunkText.length() * SENTENCE_BOUNDARY_FLOOR) {
            return chunkText.substring(0, lastPeriod + 1);
        }
        return chunkText;
    }
}
