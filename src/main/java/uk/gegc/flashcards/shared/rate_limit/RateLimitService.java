package uk.gegc.flashcards.shared.rate_limit;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.flashcards.shared.exception.RateLimitExceededException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Fixed-window request counter keyed by {@code resource:subject}.
 * A window starts on the first accepted request and ends {@code window} later; an entry whose
 * {@code resetAt} is strictly before now is treated as absent.
 */
@Slf4j
@Service
public class RateLimitService {

    private final RateLimitStore store;
    private final RateLimitProperties properties;
    private final Clock clock;
    private final ReentrantLock lock = new ReentrantLock();

    public RateLimitService(RateLimitStore store, RateLimitProperties properties, Clock clock) {
        this.store = store;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Records one request for the subject against the resource.
     *
     * @return the counter after the request was accepted
     * @throws RateLimitExceededException when the window is already full
     */
    public RateLimitEntry check(String subject, String resource) {
        String key = key(subject, resource);
        int limit = properties.limitFor(resource);
        Duration window = properties.windowFor(resource);

        lock.lock();
        try {
            Instant now = Instant.now(clock);
            Optional<RateLimitEntry> current = activeEntry(key, now);

            if (current.isEmpty()) {
                RateLimitEntry fresh = new RateLimitEntry(1, now.plus(window));
                store.set(key, fresh, window);
                log.debug("Started rate-limit window for {} until {}", key, fresh.resetAt());
                return fresh;
            }

            RateLimitEntry entry = current.get();
            if (entry.count() >= limit) {
                long retryAfterSeconds = secondsUntil(now, entry.resetAt());
                log.warn("Rate limit exceeded for {} ({} of {}), resets at {}", key, entry.count(), limit, entry.resetAt());
                throw new RateLimitExceededException("Rate limit exceeded", entry.resetAt(), retryAfterSeconds);
            }

            return store.increment(key).orElseGet(() -> {
                RateLimitEntry incremented = entry.incremented();
                store.set(key, incremented, Duration.between(now, entry.resetAt()));
                return incremented;
            });
        } finally {
            lock.unlock();
        }
    }

    public int getRemaining(String subject, String resource) {
        int limit = properties.limitFor(resource);
        return activeEntry(key(subject, resource), Instant.now(clock))
                .map(entry -> Math.max(0, limit - entry.count()))
                .orElse(limit);
    }

    /**
     * @return end of the active window, or {@code null} when the subject has none
     */
    public Instant getResetAt(String subject, String resource) {
        return activeEntry(key(subject, resource), Instant.now(clock))
                .map(RateLimitEntry::resetAt)
                .orElse(null);
    }

    public int getLimit(String resource) {
        return properties.limitFor(resource);
    }

    public void clear(String subject, String resource) {
        store.delete(key(subject, resource));
    }

    public void clearAll() {
        store.clear();
    }

    private Optional<RateLimitEntry> activeEntry(String key, Instant now) {
        return store.get(key).filter(entry -> !entry.isExpired(now));
    }

    private static long secondsUntil(Instant now, Instant resetAt) {
        long millis = Duration.between(now, resetAt).toMillis();
        return Math.max(1, (millis + 999) / 1000);
    }

    private static String key(String subject, String resource) {
        return resource + ":" + subject;
    }
}
