package com.knowledgeassist.api.service.cache;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Decides whether a computed answer may be shared with later askers. Matching is plain substring containment on the
 * lower-cased question.
 */
@Component
public class CacheAdmissionPolicy {

    static final double MIN_CONFIDENCE = 0.7;
    static final List<String> TIME_SENSITIVE_MARKERS = List.of("today", "now", "current", "latest", "deadline");
    static final List<String> PERSONAL_MARKERS = List.of("my", "i ", "me ", "mine");

    public Optional<String> rejectionReason(String question, CachedAnswer answer) {
        if (answer == null) {
            return Optional.of("no answer");
        }
        if (answer.confidence() < MIN_CONFIDENCE) {
            return Optional.of("confidence below " + MIN_CONFIDENCE);
        }
        if (answer.insufficientContext()) {
            return Optional.of("insufficient context");
        }
        String normalised = question == null ? "" : question.toLowerCase(Locale.ROOT);
        for (String marker : TIME_SENSITIVE_MARKERS) {
            if (normalised.contains(marker)) {
                return Optional.of("time-sensitive marker '" + marker + "'");
            }
        }
        for (String marker : PERSONAL_MARKERS) {
            if (normalised.contains(marker)) {
                return Optional.of("personal marker '" + marker.trim() + "'");
            }
        }
        return Optional.empty();
    }

    public boolean admits(String question, CachedAnswer answer) {
        return rejectionReason(question, answer).isEmpty();
    }
}
