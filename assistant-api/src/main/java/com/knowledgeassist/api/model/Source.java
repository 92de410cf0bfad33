package com.knowledgeassist.api.model;

public record Source(String documentName,
                     String relevantExcerpt) {
}
