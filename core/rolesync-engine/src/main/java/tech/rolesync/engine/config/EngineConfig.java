package tech.rolesync.engine.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;
import io.smallrye.config.WithName;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Reconciliation engine configuration.
 *
 * <p>Configure in application.properties:
 * <pre>
 * rolesync.engine.api-base-url=https://api.example.com
 * rolesync.engine.concurrency=4
 * rolesync.engine.rate-limit-per-minute=300
 * rolesync.engine.retry.max-attempts=3
 * rolesync.engine.error-codes."entity.unique_integrity_violation"=CONFLICT
 * </pre>
 */
@ConfigMapping(prefix = "rolesync.engine")
public interface EngineConfig {

    /**
     * Base URL used to derive resource indicators as {api-base-url}/api/{name}.
     * When unset, indicators are derived from the resource name alone and never compared.
     */
    @WithName("api-base-url")
    Optional<String> apiBaseUrl();

    /**
     * Access token lifetime, in seconds, for resources that do not declare one.
     */
    @WithName("access-token-ttl")
    @WithDefault("3600")
    int accessTokenTtl();

    /**
     * Worker threads per phase.
     */
    @WithDefault("4")
    int concurrency();

    /**
     * Upper bound on provider calls per minute. Unset disables throttling.
     */
    @WithName("rate-limit-per-minute")
    Optional<Integer> rateLimitPerMinute();

    /**
     * Page size used when reading actual state.
     */
    @WithName("page-size")
    @WithDefault("100")
    int pageSize();

    /**
     * Maximum pages read per list before the reader gives up.
     */
    @WithName("max-pages")
    @WithDefault("500")
    int maxPages();

    /**
     * Consent scopes given to third-party applications that declare none.
     */
    @WithName("default-application-scopes")
    @WithDefault("profile,email,roles,urn:logto:scope:organizations,urn:logto:scope:organization_roles")
    List<String> defaultApplicationScopes();

    /**
     * Provider error code to error kind, e.g. {@code entity.not_exists=NOT_FOUND}.
     */
    @WithName("error-codes")
    Map<String, String> errorCodes();

    RetryConfig retry();

    ProtectionConfig protection();

    interface RetryConfig {
        @WithName("max-attempts")
        @WithDefault("3")
        int maxAttempts();

        @WithName("initial-delay-ms")
        @WithDefault("200")
        long initialDelayMs();

        @WithDefault("2.0")
        double multiplier();

        @WithName("max-delay-ms")
        @WithDefault("5000")
        long maxDelayMs();
    }

    interface ProtectionConfig {
        /**
         * Resource names that are never modified.
         */
        @WithName("resource-names")
        @WithDefault("Logto Management API")
        List<String> resourceNames();

        /**
         * Resource indicators that are never modified.
         */
        @WithName("resource-indicators")
        @WithDefault("https://default.logto.app/api")
        List<String> resourceIndicators();

        /**
         * Case-insensitive fragments that mark a role or scope name as reserved.
         */
        @WithName("name-fragments")
        @WithDefault("logto,machine-to-machine,management api")
        List<String> nameFragments();

        /**
         * Name fragments of user roles that are never deleted.
         */
        @WithName("user-role-fragments")
        @WithDefault("logto,admin,machine-to-machine,system,default")
        List<String> userRoleFragments();

        /**
         * Name fragments of organization roles that are never deleted.
         */
        @WithName("organization-role-fragments")
        @WithDefault("logto,admin,system,default,owner,member")
        List<String> organizationRoleFragments();

        /**
         * Name fragments of organization scopes that are never deleted.
         */
        @WithName("organization-scope-fragments")
        @WithDefault("logto,system,default,management,api")
        List<String> organizationScopeFragments();

        /**
         * Description fragments of roles that are never deleted.
         */
        @WithName("role-description-fragments")
        @WithDefault("system,default,logto")
        List<String> roleDescriptionFragments();
    }
}
