package com.knowledgeassist.api.service.synthesis;

import com.knowledgeassist.api.model.Source;
import com.knowledgeassist.api.service.cache.CachedAnswer;

import java.util.List;

public record SynthesizedAnswer(String answer,
                                List<Source> sources,
                                double confidence,
                                boolean insufficientContext,
                                TokenUsage tokenUsage) {

    public SynthesizedAnswer {
        sources = sources == null ? List.of() : List.copyOf(sources);
        tokenUsage = tokenUsage == null ? TokenUsage.NONE : tokenUsage;
    }

    public CachedAnswer toCachedAnswer() {
        return new CachedAnswer(answer, sources, confidence, insufficientContext);
    }

    public record TokenUsage(int prompt, int completion, int total) {

        public static final TokenUsage NONE = new TokenUsage(0, 0, 0);
    }
}
