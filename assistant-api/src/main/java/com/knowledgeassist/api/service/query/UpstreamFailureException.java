package com.knowledgeassist.api.service.query;

public class UpstreamFailureException extends QueryException {

    public UpstreamFailureException(String message) {
        super(QueryFailureKind.UPSTREAM_FAILURE, message);
    }

    public UpstreamFailureException(String message, Throwable cause) {
        super(QueryFailureKind.UPSTREAM_FAILURE, message, cause);
    }
}
