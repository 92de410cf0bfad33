package com.knowledgeassist.api.service.ratelimit;

public interface RateLimiter {

    boolean allow(String tenantId, String operation);

    int limitPerMinute();
}
