package uk.gegc.flashcards.shared.rate_limit;

import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Process-local store. Counters are lost on restart and not shared between instances.
 */
@Component
public class InMemoryRateLimitStore implements RateLimitStore {

    private final Map<String, StoredEntry> entries = new HashMap<>();
    private final Clock clock;

    public InMemoryRateLimitStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public synchronized Optional<RateLimitEntry> get(String key) {
        StoredEntry stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        if (stored.expiresAt().isBefore(Instant.now(clock))) {
            entries.remove(key);
            return Optional.empty();
        }
        return Optional.of(stored.entry());
    }

    @Override
    public synchronized void set(String key, RateLimitEntry entry, Duration ttl) {
        Instant now = Instant.now(clock);
        evictExpired(now);
        entries.put(key, new StoredEntry(entry, now.plus(ttl)));
    }

    @Override
    public synchronized Optional<RateLimitEntry> increment(String key) {
        StoredEntry stored = entries.get(key);
        if (stored == null) {
            return Optional.empty();
        }
        RateLimitEntry updated = stored.entry().incremented();
        entries.put(key, new StoredEntry(updated, stored.expiresAt()));
        return Optional.of(updated);
    }

    @Override
    public synchronized void delete(String key) {
        entries.remove(key);
    }

    @Override
    public synchronized void clear() {
        entries.clear();
    }

    // storing a new window is the only way the map grows
    private void evictExpired(Instant now) {
        entries.values().removeIf(stored -> stored.expiresAt().isBefore(now));
    }

    synchronized int size() {
        return entries.size();
    }

    private record StoredEntry(RateLimitEntry entry, Instant expiresAt) {
    }
}
