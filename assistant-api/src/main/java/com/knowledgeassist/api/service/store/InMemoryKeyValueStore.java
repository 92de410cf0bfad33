package com.knowledgeassist.api.service.store;

import org.springframework.context.annotation.Profile;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Process-local store for single-node runs and tests. Expired entries are dropped on access, and writes sweep the
 * whole map at most once per {@link #SWEEP_INTERVAL} so keys that are never read again still go away.
 */
@Component
@Profile("inmemory")
public class InMemoryKeyValueStore implements KeyValueStore {

    static final Duration SWEEP_INTERVAL = Duration.ofSeconds(30);

    private final ConcurrentMap<String, Entry> entries = new ConcurrentHashMap<>();
    private final AtomicReference<Instant> nextSweep;
    private final Clock clock;

    public InMemoryKeyValueStore(Clock clock) {
        this.clock = clock;
        this.nextSweep = new AtomicReference<>(clock.instant().plus(SWEEP_INTERVAL));
    }

    @Override
    public Optional<String> get(String key) {
        Instant now = clock.instant();
        Entry entry = entries.computeIfPresent(key, (k, existing) -> existing.expiredAt(now) ? null : existing);
        return entry == null ? Optional.empty() : Optional.of(entry.value());
    }

    @Override
    public void set(String key, String value, Duration ttl) {
        Instant now = clock.instant();
        sweepIfDue(now);
        entries.put(key, new Entry(value, now.plus(ttl)));
    }

    @Override
    public long incrementWithExpiry(String key, Duration ttl) {
        Instant now = clock.instant();
        sweepIfDue(now);
        Entry updated = entries.compute(key, (k, existing) -> {
            if (existing == null || existing.expiredAt(now)) {
                return new Entry("1", now.plus(ttl));
            }
            return new Entry(Long.toString(Long.parseLong(existing.value()) + 1), existing.expiresAt());
        });
        return Long.parseLong(updated.value());
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    int size() {
        return entries.size();
    }

    private void sweepIfDue(Instant now) {
        Instant due = nextSweep.get();
        if (now.isBefore(due) || !nextSweep.compareAndSet(due, now.plus(SWEEP_INTERVAL))) {
            return;
        }
        entries.entrySet().removeIf(e -> e.getValue().expiredAt(now));
    }

    private record Entry(String value, Instant expiresAt) {

        boolean expiredAt(Instant now) {
            return !now.isBefore(expiresAt);
        }
    }
}
