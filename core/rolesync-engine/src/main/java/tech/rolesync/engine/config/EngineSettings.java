package tech.rolesync.engine.config;

import tech.rolesync.engine.exec.RetryPolicy;
import tech.rolesync.engine.guard.ProtectionPolicy;

import java.util.List;
import java.util.Map;

/**
 * Resolved engine settings. Built from {@link EngineConfig} at runtime, or directly in tests.
 */
public record EngineSettings(
    String apiBaseUrl,
    int accessTokenTtl,
    int concurrency,
    Integer rateLimitPerMinute,
    int pageSize,
    int maxPages,
    List<String> defaultApplicationScopes,
    Map<String, String> errorCodes,
    RetryPolicy retryPolicy,
    ProtectionPolicy protection
) {

    public static final List<String> DEFAULT_APPLICATION_SCOPES = List.of(
        "profile", "email", "roles",
        "urn:logto:scope:organizations", "urn:logto:scope:organization_roles"
    );

    public EngineSettings {
        defaultApplicationScopes = List.copyOf(defaultApplicationScopes);
        errorCodes = Map.copyOf(errorCodes);
    }

    public static EngineSettings from(EngineConfig config) {
        return new EngineSettings(
            config.apiBaseUrl().map(url -> url.replaceAll("/$", "")).orElse(null),
            config.accessTokenTtl(),
            config.concurrency(),
            config.rateLimitPerMinute().orElse(null),
            config.pageSize(),
            config.maxPages(),
            config.defaultApplicationScopes(),
            config.errorCodes(),
            RetryPolicy.from(config.retry()),
            ProtectionPolicy.from(config.protection())
        );
    }

    public static EngineSettings defaults() {
        return new EngineSettings(null, 3600, 4, null, 100, 500,
            DEFAULT_APPLICATION_SCOPES, Map.of(), RetryPolicy.defaults(), ProtectionPolicy.defaults());
    }

    public EngineSettings withApiBaseUrl(String url) {
        return new EngineSettings(url, accessTokenTtl, concurrency, rateLimitPerMinute, pageSize, maxPages,
            defaultApplicationScopes, errorCodes, retryPolicy, protection);
    }

    public EngineSettings withPaging(int pageSize, int maxPages) {
        return new EngineSettings(apiBaseUrl, accessTokenTtl, concurrency, rateLimitPerMinute, pageSize, maxPages,
            defaultApplicationScopes, errorCodes, retryPolicy, protection);
    }

    public EngineSettings withRetryPolicy(RetryPolicy policy) {
        return new EngineSettings(apiBaseUrl, accessTokenTtl, concurrency, rateLimitPerMinute, pageSize, maxPages,
            defaultApplicationScopes, errorCodes, policy, protection);
    }

    public EngineSettings withConcurrency(int workers) {
        return new EngineSettings(apiBaseUrl, accessTokenTtl, workers, rateLimitPerMinute, pageSize, maxPages,
            defaultApplicationScopes, errorCodes, retryPolicy, protection);
    }

    /**
     * Indicator the provider should hold for a resource.
     */
    public String indicatorFor(String resourceName) {
        String base = apiBaseUrl != null ? apiBaseUrl : "https://rolesync.local";
        return base + "/api/" + resourceName;
    }

    public boolean comparesIndicators() {
        return apiBaseUrl != null;
    }
}
