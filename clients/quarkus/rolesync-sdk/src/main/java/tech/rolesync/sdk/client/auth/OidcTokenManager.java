package tech.rolesync.sdk.client.auth;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rolesync.sdk.config.ManagementApiConfig;
import tech.rolesync.sdk.exception.AuthenticationException;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Obtains and caches client-credentials tokens for the management API.
 *
 * <p>The token is requested for the management API resource indicator with
 * the configured scope, and refreshed shortly before it expires.
 */
@ApplicationScoped
public class OidcTokenManager {

    private static final Logger LOG = Logger.getLogger(OidcTokenManager.class);

    private final ManagementApiConfig config;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final ReentrantLock lock = new ReentrantLock();

    private String accessToken;
    private Instant expiresAt;

    @Inject
    public OidcTokenManager(ManagementApiConfig config) {
        this.config = config;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().timeout()))
            .build();
        this.objectMapper = new ObjectMapper();
    }

    /**
     * Get a valid access token, fetching a new one if necessary.
     */
    public String getAccessToken() {
        lock.lock();
        try {
            if (isTokenValid()) {
                return accessToken;
            }
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Discard the cached token and fetch a new one.
     */
    public String refreshToken() {
        lock.lock();
        try {
            accessToken = null;
            expiresAt = null;
            return fetchNewToken();
        } finally {
            lock.unlock();
        }
    }

    private boolean isTokenValid() {
        return accessToken != null
            && expiresAt != null
            && Instant.now().plusSeconds(config.http().tokenRefreshMargin()).isBefore(expiresAt);
    }

    private String fetchNewToken() {
        String clientId = config.clientId()
            .orElseThrow(AuthenticationException::missingCredentials);
        String clientSecret = config.clientSecret()
            .orElseThrow(AuthenticationException::missingCredentials);

        String baseUrl = trimTrailingSlash(config.baseUrl());
        String tokenUrl = config.tokenUrl().orElse(baseUrl + "/oidc/token");
        String resource = config.apiResource().orElse(baseUrl + "/api");

        Map<String, String> form = new LinkedHashMap<>();
        form.put("grant_type", "client_credentials");
        form.put("client_id", clientId);
        form.put("client_secret", clientSecret);
        form.put("resource", resource);
        form.put("scope", config.scope());

        LOG.debugf("Requesting management API token from %s", tokenUrl);

        try {
            HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(tokenUrl))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(encodeForm(form)))
                .timeout(Duration.ofSeconds(config.http().timeout()))
                .build();

            HttpResponse<String> response = httpClient.send(
                request, HttpResponse.BodyHandlers.ofString()
            );

            if (response.statusCode() != 200) {
                throw AuthenticationException.invalidCredentials(response.statusCode());
            }

            JsonNode json = objectMapper.readTree(response.body());
            JsonNode token = json.get("access_token");
            if (token == null || token.asText().isBlank()) {
                throw new AuthenticationException("Token response did not contain an access_token");
            }

            this.accessToken = token.asText();
            this.expiresAt = Instant.now().plusSeconds(json.path("expires_in").asLong(3600));

            LOG.debugf("Management API token obtained, expires at %s", expiresAt);
            return this.accessToken;
        } catch (AuthenticationException e) {
            throw e;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AuthenticationException("Interrupted while fetching access token", e);
        } catch (Exception e) {
            throw new AuthenticationException("Failed to fetch access token", e);
        }
    }

    private static String encodeForm(Map<String, String> form) {
        return form.entrySet().stream()
            .map(e -> URLEncoder.encode(e.getKey(), StandardCharsets.UTF_8)
                + "=" + URLEncoder.encode(e.getValue(), StandardCharsets.UTF_8))
            .collect(Collectors.joining("&"));
    }

    static String trimTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
