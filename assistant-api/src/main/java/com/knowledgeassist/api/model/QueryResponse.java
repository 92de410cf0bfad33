package com.knowledgeassist.api.model;

import java.util.List;

public record QueryResponse(
        String answer,
        List<Source> sources,
        Double confidence,
        boolean insufficientContext,
        long processingTimeMs,
        boolean cached
) {
}
