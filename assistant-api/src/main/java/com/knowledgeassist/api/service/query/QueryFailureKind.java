package com.knowledgeassist.api.service.query;

import org.springframework.http.HttpStatus;

public enum QueryFailureKind {

    THROTTLED(HttpStatus.TOO_MANY_REQUESTS),
    SECURITY_VIOLATION(HttpStatus.INTERNAL_SERVER_ERROR),
    UPSTREAM_FAILURE(HttpStatus.BAD_GATEWAY);

    private final HttpStatus status;

    QueryFailureKind(HttpStatus status) {
        this.status = status;
    }

    public HttpStatus status() {
        return status;
    }
}
