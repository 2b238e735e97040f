package tech.rolesync.engine.provider;

import java.time.Duration;

/**
 * Kinds of {@link ProviderError}, as named in the error-code table.
 */
public enum ProviderErrorKind {
    NOT_FOUND,
    CONFLICT,
    REJECTED,
    UNAUTHORIZED,
    RATE_LIMITED,
    SERVER_ERROR,
    NETWORK_ERROR;

    /**
     * Build an error of this kind.
     */
    public ProviderError toError(int statusCode, String message, Duration retryAfter) {
        return switch (this) {
            case NOT_FOUND -> new ProviderError.NotFound(message);
            case CONFLICT -> new ProviderError.Conflict(message);
            case REJECTED -> new ProviderError.Rejected(statusCode, message);
            case UNAUTHORIZED -> new ProviderError.Unauthorized(statusCode, message);
            case RATE_LIMITED -> new ProviderError.RateLimited(message, retryAfter);
            case SERVER_ERROR -> new ProviderError.ServerError(statusCode, message);
            case NETWORK_ERROR -> new ProviderError.NetworkError(message);
        };
    }
}
