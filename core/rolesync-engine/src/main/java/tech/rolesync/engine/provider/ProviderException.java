package tech.rolesync.engine.provider;

/**
 * Thrown by {@link IdentityProviderClient} implementations; carries the typed error.
 */
public class ProviderException extends RuntimeException {

    private final ProviderError error;

    public ProviderException(ProviderError error) {
        this(error, null);
    }

    public ProviderException(ProviderError error, Throwable cause) {
        super(error.message(), cause);
        this.error = error;
    }

    public ProviderError getError() {
        return error;
    }

    public boolean isRetryable() {
        return error.isRetryable();
    }
}
