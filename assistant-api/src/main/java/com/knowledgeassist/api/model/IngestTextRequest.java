package com.knowledgeassist.api.model;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record IngestTextRequest(@NotBlank @Size(max = 500) String name,
                                @NotBlank String text,
                                String contentType) {
}
