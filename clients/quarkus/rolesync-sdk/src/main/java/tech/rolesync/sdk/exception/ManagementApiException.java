package tech.rolesync.sdk.exception;

import java.util.Map;

/**
 * Base exception for management API errors.
 *
 * <p>{@code errorCode} carries the provider's own error code (for example
 * {@code entity.unique_integrity_violation}) when the response body had one.
 */
public class ManagementApiException extends RuntimeException {

    private final int statusCode;
    private final String errorCode;
    private final Map<String, Object> context;

    public ManagementApiException(String message) {
        this(message, 0, null, null, Map.of());
    }

    public ManagementApiException(String message, int statusCode) {
        this(message, statusCode, null, null, Map.of());
    }

    public ManagementApiException(String message, Throwable cause) {
        this(message, 0, null, cause, Map.of());
    }

    public ManagementApiException(String message, int statusCode, String errorCode,
                                  Throwable cause, Map<String, Object> context) {
        super(message, cause);
        this.statusCode = statusCode;
        this.errorCode = errorCode;
        this.context = context != null ? context : Map.of();
    }

    public int getStatusCode() {
        return statusCode;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Map<String, Object> getContext() {
        return context;
    }

    /**
     * True when no HTTP response was received (connection refused, timeout).
     */
    public boolean isTransportFailure() {
        return statusCode == 0;
    }
}
