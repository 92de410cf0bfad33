package com.knowledgeassist.api.model;

import java.util.Map;

public record HealthResponse(String status,
                             Map<String, String> services) {
}
