package uk.gegc.flashcards.shared.rate_limit;

import java.time.Duration;
import java.util.Optional;

/**
 * Key-value table holding rate-limit counters. Implementations may be process-local or shared
 * (e.g. a Redis-backed store); {@link RateLimitService} serialises its own read-modify-write sequence.
 */
public interface RateLimitStore {

    Optional<RateLimitEntry> get(String key);

    void set(String key, RateLimitEntry entry, Duration ttl);

    /**
     * Increments the counter stored under {@code key}.
     *
     * @return the updated entry, or empty when nothing is stored under the key
     */
    Optional<RateLimitEntry> increment(String key);

    void delete(String key);

    void clear();
}
