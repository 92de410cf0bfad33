package com.knowledgeassist.api.service.ratelimit;

import com.knowledgeassist.api.service.store.KeyValueStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;

/**
 * Per-tenant fixed one-minute windows. A burst straddling a window boundary can pass up to twice the nominal limit.
 */
@Component
public class FixedWindowRateLimiter implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(FixedWindowRateLimiter.class);

    private static final long WINDOW_SECONDS = 60;
    private static final Duration WINDOW = Duration.ofSeconds(WINDOW_SECONDS);
    private static final String KEY_PREFIX = "ratelimit:";

    private final KeyValueStore store;
    private final Clock clock;
    private final int limitPerMinute;

    public FixedWindowRateLimiter(KeyValueStore store,
                                  Clock clock,
                                  @Value("${assistant.rate-limit.queries-per-minute:10}") int limitPerMinute) {
        this.store = store;
        this.clock = clock;
        this.limitPerMinute = Math.max(1, limitPerMinute);
    }

    @Override
    public boolean allow(String tenantId, String operation) {
        long window = Math.floorDiv(clock.millis() / 1000, WINDOW_SECONDS);
        String key = KEY_PREFIX + tenantId + ":" + operation + ":" + window;
        long count = store.incrementWithExpiry(key, WINDOW);
        if (count > limitPerMinute) {
            log.info("Rate limit reached for tenant {} operation {} ({} in window {})", tenantId, operation, count, window);
            return false;
        }
        return true;
    }

    @Override
    public int limitPerMinute() {
        return limitPerMinute;
    }
}
