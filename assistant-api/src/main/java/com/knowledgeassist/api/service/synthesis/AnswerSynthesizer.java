package com.knowledgeassist.api.service.synthesis;

import com.knowledgeassist.api.model.RetrievedFragment;

import java.util.List;

public interface AnswerSynthesizer {

    /**
     * @param context non-empty, ordered by relevance
     */
    SynthesizedAnswer synthesize(String question, List<RetrievedFragment> context, String tenantName);
}
