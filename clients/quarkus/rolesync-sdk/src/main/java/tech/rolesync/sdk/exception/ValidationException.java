package tech.rolesync.sdk.exception;

import java.util.Map;

/**
 * Exception thrown when the management API rejects a request payload (400/422).
 */
public class ValidationException extends ManagementApiException {

    private final Object details;

    public ValidationException(String message, int statusCode, String errorCode, Object details) {
        super(message, statusCode, errorCode, null, Map.of());
        this.details = details;
    }

    public Object getDetails() {
        return details;
    }

    public static ValidationException fromResponse(int status, Map<String, Object> response) {
        String message = (String) response.getOrDefault("message", "Validation failed");
        String code = (String) response.get("code");
        return new ValidationException(message, status, code, response.get("data"));
    }
}
