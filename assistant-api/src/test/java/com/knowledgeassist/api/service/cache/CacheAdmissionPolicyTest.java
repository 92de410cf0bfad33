package com.knowledgeassist.api.service.cache;

import com.knowledgeassist.api.model.Source;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class CacheAdmissionPolicyTest {

    private final CacheAdmissionPolicy policy = new CacheAdmissionPolicy();

    @Test
    void admitsConfidentGeneralAnswer() {
        assertThat(policy.admits("How many vacation days do employees get?", answer(0.95, false))).isTrue();
    }

    @Test
    void rejectsLowConfidence() {
        assertThat(policy.rejectionReason("How many vacation days?", answer(0.69, false)))
                .hasValueSatisfying(reason -> assertThat(reason).contains("confidence"));
        assertThat(policy.admits("How many vacation days?", answer(0.7, false))).isTrue();
    }

    @Test
    void rejectsInsufficientContext() {
        assertThat(policy.admits("How many vacation days?", answer(0.9, true))).isFalse();
    }

    @Test
    void rejectsPersonalQuestions() {
        assertThat(policy.rejectionReason("What is my vacation policy?", answer(0.9, false)))
                .hasValueSatisfying(reason -> assertThat(reason).contains("my"));
    }

    @Test
    void rejectsTimeSensitiveQuestions() {
        assertThat(policy.admits("What is the latest expense limit?", answer(0.9, false))).isFalse();
        assertThat(policy.admits("Who is on call TODAY?", answer(0.9, false))).isFalse();
    }

    @Test
    void markerMatchingIsPlainSubstring() {
        // "known" contains "now"
        assertThat(policy.admits("What are the known issues?", answer(0.9, false))).isFalse();
    }

    @Test
    void rejectsMissingAnswer() {
        assertThat(policy.admits("Anything", null)).isFalse();
    }

    private CachedAnswer answer(double confidence, boolean insufficient) {
        return new CachedAnswer("Twenty days.", List.of(new Source("handbook.md", "20 days")), confidence, insufficient);
    }
}
