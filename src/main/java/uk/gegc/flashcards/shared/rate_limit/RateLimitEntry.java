package uk.gegc.flashcards.shared.rate_limit;

import java.time.Instant;

/**
 * Counter for one fixed window.
 *
 * @param count   requests accepted in the window
 * @param resetAt instant at which the window ends
 */
public record RateLimitEntry(int count, Instant resetAt) {

    public RateLimitEntry {
        if (count < 0) {
            throw new IllegalArgumentException("count must be >= 0");
        }
        if (resetAt == null) {
            throw new IllegalArgumentException("resetAt must not be null");
        }
    }

    public RateLimitEntry incremented() {
        return new RateLimitEntry(count + 1, resetAt);
    }

    public boolean isExpired(Instant now) {
        return resetAt.isBefore(now);
    }
}
