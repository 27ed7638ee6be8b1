package uk.gegc.flashcards.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.time.Instant;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class RateLimitExceededException extends RuntimeException {
    private final Instant resetAt;
    private final long retryAfterSeconds;

    public RateLimitExceededException(String message, Instant resetAt, long retryAfterSeconds) {
        super(message);
        this.resetAt = resetAt;
        this.retryAfterSeconds = Math.max(1, retryAfterSeconds);
    }

    public Instant getResetAt() {
        return resetAt;
    }

    public long getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
