package tech.rolesync.sdk.exception;

/**
 * Exception thrown when the management API rejects or cannot issue credentials.
 */
public class AuthenticationException extends ManagementApiException {

    public AuthenticationException(String message) {
        super(message, 401);
    }

    public AuthenticationException(String message, Throwable cause) {
        super(message, 401, null, cause, null);
    }

    public static AuthenticationException tokenRejected() {
        return new AuthenticationException("Access token rejected by management API");
    }

    public static AuthenticationException invalidCredentials(int status) {
        return new AuthenticationException("Token endpoint returned status " + status);
    }

    public static AuthenticationException missingCredentials() {
        return new AuthenticationException("Client ID and secret are required");
    }
}
