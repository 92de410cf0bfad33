package com.knowledgeassist.api.service.query;

public class RateLimitExceededException extends QueryException {

    private final int limitPerMinute;

    public RateLimitExceededException(int limitPerMinute) {
        super(QueryFailureKind.THROTTLED, "Rate limit exceeded: " + limitPerMinute + " queries per minute");
        this.limitPerMinute = limitPerMinute;
    }

    public int limitPerMinute() {
        return limitPerMinute;
    }
}
