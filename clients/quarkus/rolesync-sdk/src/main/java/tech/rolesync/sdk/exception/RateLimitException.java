package tech.rolesync.sdk.exception;

import java.time.Duration;
import java.util.Optional;

/**
 * Exception thrown on HTTP 429. Carries the server's Retry-After hint when present.
 */
public class RateLimitException extends ManagementApiException {

    private final Duration retryAfter;

    public RateLimitException(String message, Duration retryAfter) {
        super(message, 429);
        this.retryAfter = retryAfter;
    }

    public Optional<Duration> getRetryAfter() {
        return Optional.ofNullable(retryAfter);
    }
}
