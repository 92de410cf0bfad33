package com.knowledgeassist.api.model;

import java.time.OffsetDateTime;

public record DocumentListItem(String id,
                               String name,
                               String contentType,
                               OffsetDateTime uploadedAt) {
}
