package tech.rolesync.engine.provider;

import java.time.Duration;

/**
 * Typed failure of a call to the identity provider.
 *
 * <h2>Error Types</h2>
 * <ul>
 *   <li>{@link NotFound} - entity does not exist (not retryable)</li>
 *   <li>{@link Conflict} - uniqueness or state conflict (not retryable)</li>
 *   <li>{@link Rejected} - payload failed provider validation (not retryable)</li>
 *   <li>{@link Unauthorized} - credentials missing, expired or lacking permission (not retryable)</li>
 *   <li>{@link RateLimited} - HTTP 429 (retryable after delay)</li>
 *   <li>{@link ServerError} - HTTP 5xx (retryable)</li>
 *   <li>{@link NetworkError} - no response received (retryable)</li>
 * </ul>
 */
public sealed interface ProviderError permits
    ProviderError.NotFound,
    ProviderError.Conflict,
    ProviderError.Rejected,
    ProviderError.Unauthorized,
    ProviderError.RateLimited,
    ProviderError.ServerError,
    ProviderError.NetworkError {

    /**
     * Human-readable description of the error.
     */
    String message();

    /**
     * True if repeating the same call may succeed.
     */
    boolean isRetryable();

    /**
     * Stable kind, used for reporting and the error-code table.
     */
    ProviderErrorKind kind();

    record NotFound(String message) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.NOT_FOUND;
        }
    }

    record Conflict(String message) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.CONFLICT;
        }
    }

    /**
     * @param statusCode 400 or 422 usually
     */
    record Rejected(int statusCode, String message) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.REJECTED;
        }
    }

    /**
     * @param statusCode 401 or 403
     */
    record Unauthorized(int statusCode, String message) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return false;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.UNAUTHORIZED;
        }
    }

    /**
     * @param retryAfter server hint, or null
     */
    record RateLimited(String message, Duration retryAfter) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return true;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.RATE_LIMITED;
        }
    }

    record ServerError(int statusCode, String message) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return true;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.SERVER_ERROR;
        }
    }

    record NetworkError(String message) implements ProviderError {
        @Override
        public boolean isRetryable() {
            return true;
        }

        @Override
        public ProviderErrorKind kind() {
            return ProviderErrorKind.NETWORK_ERROR;
        }
    }
}
