package com.knowledgeassist.api.service.query;

import org.springframework.http.HttpStatus;

/**
 * Base type for failures that end a query. Callers branch on {@link #kind()}; a
 * {@link QueryFailureKind#SECURITY_VIOLATION} must reach the audit trail before anything else handles it.
 */
public abstract class QueryException extends RuntimeException {

    private final QueryFailureKind kind;

    protected QueryException(QueryFailureKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    protected QueryException(QueryFailureKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public QueryFailureKind kind() {
        return kind;
    }

    public HttpStatus status() {
        return kind.status();
    }
}
