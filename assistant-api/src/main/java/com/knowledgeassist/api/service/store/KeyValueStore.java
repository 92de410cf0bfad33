package com.knowledgeassist.api.service.store;

import java.time.Duration;
import java.util.Optional;

/**
 * Single-key operations shared by the answer cache and the rate limiter. Every method is atomic on its own; callers
 * never rely on two calls observing a consistent view.
 */
public interface KeyValueStore {

    Optional<String> get(String key);

    void set(String key, String value, Duration ttl);

    /**
     * Increments the counter at {@code key}, creating it at 1 when absent. The expiry is applied only when this call
     * created the counter, so later increments inside the same window never extend it.
     *
     * @return the post-increment value
     */
    long incrementWithExpiry(String key, Duration ttl);

    boolean isAvailable();
}
