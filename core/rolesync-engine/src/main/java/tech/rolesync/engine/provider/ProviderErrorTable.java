package tech.rolesync.engine.provider;

import org.jboss.logging.Logger;

import java.time.Duration;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps provider error codes and HTTP statuses to {@link ProviderError} kinds.
 *
 * <p>The code table is configuration data ({@code rolesync.engine.error-codes}).
 * A code absent from the table falls back to classification by status.
 */
public class ProviderErrorTable {

    private static final Logger LOG = Logger.getLogger(ProviderErrorTable.class);

    private final Map<String, ProviderErrorKind> byCode;

    public ProviderErrorTable(Map<String, String> codes) {
        this.byCode = new HashMap<>();
        codes.forEach((code, kind) -> {
            try {
                byCode.put(code, ProviderErrorKind.valueOf(kind.trim().toUpperCase(Locale.ROOT)));
            } catch (IllegalArgumentException e) {
                LOG.warnf("Ignoring error-code mapping [%s=%s]: unknown kind", code, kind);
            }
        });
    }

    /**
     * Classify a failed call.
     *
     * @param statusCode HTTP status, or 0 when no response was received
     * @param errorCode provider error code, may be null
     */
    public ProviderError classify(int statusCode, String errorCode, String message, Duration retryAfter) {
        if (errorCode != null) {
            ProviderErrorKind kind = byCode.get(errorCode);
            if (kind != null) {
                return kind.toError(statusCode, message, retryAfter);
            }
        }
        return byStatus(statusCode).toError(statusCode, message, retryAfter);
    }

    public int size() {
        return byCode.size();
    }

    static ProviderErrorKind byStatus(int statusCode) {
        if (statusCode == 0) {
            return ProviderErrorKind.NETWORK_ERROR;
        }
        if (statusCode == 401 || statusCode == 403) {
            return ProviderErrorKind.UNAUTHORIZED;
        }
        if (statusCode == 404) {
            return ProviderErrorKind.NOT_FOUND;
        }
        if (statusCode == 409) {
            return ProviderErrorKind.CONFLICT;
        }
        if (statusCode == 429) {
            return ProviderErrorKind.RATE_LIMITED;
        }
        if (statusCode >= 500) {
            return ProviderErrorKind.SERVER_ERROR;
        }
        if (statusCode == 408) {
            return ProviderErrorKind.NETWORK_ERROR;
        }
        return ProviderErrorKind.REJECTED;
    }
}
