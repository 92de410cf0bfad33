package com.knowledgeassist.api.service.store;

import com.knowledgeassist.api.service.query.UpstreamFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Profile;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.connection.RedisConnection;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.script.RedisScript;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

@Component
@Profile("!inmemory")
public class RedisKeyValueStore implements KeyValueStore {

    private static final Logger log = LoggerFactory.getLogger(RedisKeyValueStore.class);

    // INCR and PEXPIRE run as one script so a counter can never be left without its expiry.
    static final RedisScript<Long> INCREMENT_WITH_EXPIRY = RedisScript.of(
            "local count = redis.call('INCR', KEYS[1])\n"
                    + "if count == 1 then redis.call('PEXPIRE', KEYS[1], ARGV[1]) end\n"
                    + "return count",
            Long.class);

    private final StringRedisTemplate redisTemplate;

    public RedisKeyValueStore(StringRedisTemplate redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    @Override
    public Optional<String> get(String key) {
        try {
            return Optional.ofNullable(redisTemplate.opsForValue().get(key));
        } catch (DataAccessException e) {
            throw new UpstreamFailureException("Failed to read from Redis", e);
        }
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(key, value, ttl);
        } catch (DataAccessException e) {
            throw new UpstreamFailureException("Failed to write to Redis", e);
        }
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        Long count;
        try {
            count = redisTemplate.execute(INCREMENT_WITH_EXPIRY, List.of(key), String.valueOf(ttl.toMillis()));
        } catch (DataAccessException e) {
            throw new UpstreamFailureException("Failed to increment Redis counter", e);
        }
        if (count == null) {
            throw new UpstreamFailureException("Redis returned no value for counter " + key);
        }
        return count;
    }

    @Override
    public boolean isAvailable() {
        try {
            String reply = redisTemplate.execute((RedisCallback<String>) RedisConnection::ping);
            return "PONG".equalsIgnoreCase(reply);
        } catch (DataAccessException e) {
            log.warn("Redis ping failed: {}", e.getMessage());
            return false;
        }
    }
}
