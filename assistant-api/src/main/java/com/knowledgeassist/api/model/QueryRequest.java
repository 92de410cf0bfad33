package com.knowledgeassist.api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record QueryRequest(@NotBlank @Size(min = 1, max = 1000) String question) {
}
