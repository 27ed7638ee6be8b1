package uk.gegc.flashcards.shared.rate_limit;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

/**
 * Per-resource fixed-window limits. Resources without a policy fall back to the defaults.
 */
@Component
@ConfigurationProperties(prefix = "app.rate-limit")
@Data
public class RateLimitProperties {

    /**
     * Requests allowed per window when no policy is configured for the resource
     */
    private int defaultLimit = 10;

    /**
     * Window length when no policy is configured for the resource
     */
    private Duration defaultWindow = Duration.ofHours(1);

    /**
     * Policies keyed by resource name, e.g. {@code generation-requests}
     */
    private Map<String, Policy> policies = new HashMap<>();

    public int limitFor(String resource) {
        Policy policy = policies.get(resource);
        return policy != null && policy.getLimit() != null ? policy.getLimit() : defaultLimit;
    }

    public Duration windowFor(String resource) {
        Policy policy = policies.get(resource);
        return policy != null && policy.getWindow() != null ? policy.getWindow() : defaultWindow;
    }

    @Data
    public static class Policy {
        private Integer limit;
        private Duration window;
    }
}
