package com.knowledgeassist.api.service.cache;

import com.knowledgeassist.api.model.Source;

import java.util.List;

public record CachedAnswer(String answer,
                           List<Source> sources,
                           double confidence,
                           boolean insufficientContext) {

    public CachedAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
    }
}
