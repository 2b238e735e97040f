package tech.rolesync.sdk.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.Optional;

/**
 * Configuration for the identity provider management API client.
 *
 * <p>Configure in application.properties:
 * <pre>
 * rolesync.management-api.base-url=https://your-tenant.logto.app
 * rolesync.management-api.client-id=your_m2m_app_id
 * rolesync.management-api.client-secret=your_m2m_app_secret
 * </pre>
 */
@ConfigMapping(prefix = "rolesync.management-api")
public interface ManagementApiConfig {

    /**
     * Base URL of the identity provider tenant.
     */
    @WithName("base-url")
    @WithDefault("http://localhost:3001")
    String baseUrl();

    /**
     * Machine-to-machine application ID.
     */
    @WithName("client-id")
    Optional<String> clientId();

    /**
     * Machine-to-machine application secret.
     */
    @WithName("client-secret")
    Optional<String> clientSecret();

    /**
     * OAuth2 token endpoint. Defaults to {base-url}/oidc/token.
     */
    @WithName("token-url")
    Optional<String> tokenUrl();

    /**
     * Management API resource indicator requested with the token. Defaults to {base-url}/api.
     */
    @WithName("api-resource")
    Optional<String> apiResource();

    /**
     * Scope requested with the token.
     */
    @WithDefault("all")
    String scope();

    /**
     * HTTP client configuration.
     */
    HttpConfig http();

    interface HttpConfig {
        /**
         * Request timeout in seconds.
         */
        @WithDefault("30")
        int timeout();

        /**
         * Seconds before expiry at which a cached token is refreshed.
         */
        @WithName("token-refresh-margin")
        @WithDefault("300")
        int tokenRefreshMargin();
    }
}
