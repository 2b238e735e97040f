package tech.rolesync.sdk.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rolesync.sdk.client.auth.OidcTokenManager;
import tech.rolesync.sdk.client.resources.*;
import tech.rolesync.sdk.config.ManagementApiConfig;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.exception.AuthenticationException;
import tech.rolesync.sdk.exception.ManagementApiException;
import tech.rolesync.sdk.exception.RateLimitException;
import tech.rolesync.sdk.exception.ValidationException;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Client for the identity provider management API.
 *
 * <p>Each call is a single attempt; retry and backoff belong to the caller.
 * The only automatic repeat is one token refresh when the API answers 401.
 *
 * <p>Example usage:
 * <pre>{@code
 * @Inject
 * ManagementApiClient client;
 *
 * var page = client.resources().list(1, 100);
 * var scope = client.resources().createScope(resourceId, "systems:read", "Permission to read systems");
 * }</pre>
 */
@ApplicationScoped
public class ManagementApiClient {

    private static final Logger LOG = Logger.getLogger(ManagementApiClient.class);

    static final String TOTAL_HEADER = "Total-Number";

    private final ManagementApiConfig config;
    private final OidcTokenManager tokenManager;
    private final HttpClient httpClient;
    private final ObjectMapper objectMapper;

    private ApiResources resources;
    private Roles roles;
    private OrganizationScopes organizationScopes;
    private OrganizationRoles organizationRoles;
    private Applications applications;

    @Inject
    public ManagementApiClient(ManagementApiConfig config, OidcTokenManager tokenManager) {
        this.config = config;
        this.tokenManager = tokenManager;
        this.httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(config.http().timeout()))
            .build();
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Get the API resources (and resource scopes) endpoint group.
     */
    public ApiResources resources() {
        if (resources == null) {
            resources = new ApiResources(this);
        }
        return resources;
    }

    /**
     * Get the tenant roles endpoint group.
     */
    public Roles roles() {
        if (roles == null) {
            roles = new Roles(this);
        }
        return roles;
    }

    /**
     * Get the organization scopes endpoint group.
     */
    public OrganizationScopes organizationScopes() {
        if (organizationScopes == null) {
            organizationScopes = new OrganizationScopes(this);
        }
        return organizationScopes;
    }

    /**
     * Get the organization roles endpoint group.
     */
    public OrganizationRoles organizationRoles() {
        if (organizationRoles == null) {
            organizationRoles = new OrganizationRoles(this);
        }
        return organizationRoles;
    }

    /**
     * Get the applications endpoint group.
     */
    public Applications applications() {
        if (applications == null) {
            applications = new Applications(this);
        }
        return applications;
    }

    /**
     * Make an authenticated API request and decode the response body.
     */
    public <T> T request(String method, String endpoint, Object body, TypeReference<T> responseType) {
        HttpResponse<String> response = send(method, endpoint, body);
        String payload = response.body();
        if (payload == null || payload.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(payload, responseType);
        } catch (Exception e) {
            throw new ManagementApiException("Failed to parse response from " + endpoint, e);
        }
    }

    /**
     * Make an authenticated API request, ignoring any response body.
     */
    public void requestVoid(String method, String endpoint, Object body) {
        send(method, endpoint, body);
    }

    /**
     * Fetch one page of a list endpoint.
     *
     * <p>Accepts both a bare JSON array and a {@code {"data": [...]}} envelope.
     * The total, when present, is read from the {@code Total-Number} header.
     */
    public <T> PageResult<T> requestPage(String endpoint, int page, int pageSize, Class<T> itemType) {
        String separator = endpoint.contains("?") ? "&" : "?";
        String pagedEndpoint = endpoint + separator + "page=" + page + "&page_size=" + pageSize;

        HttpResponse<String> response = send("GET", pagedEndpoint, null);
        String payload = response.body();
        if (payload == null || payload.isBlank()) {
            return PageResult.empty(page, pageSize);
        }

        try {
            JsonNode root = objectMapper.readTree(payload);
            JsonNode array = root.isObject() && root.has("data") ? root.get("data") : root;
            if (!array.isArray()) {
                throw new ManagementApiException("Expected a JSON array from " + endpoint);
            }

            JavaType listType = objectMapper.getTypeFactory().constructCollectionType(List.class, itemType);
            List<T> items = objectMapper.convertValue(array, listType);

            Long total = response.headers().firstValue(TOTAL_HEADER)
                .map(Long::parseLong)
                .orElse(root.isObject() && root.has("totalCount") ? root.get("totalCount").asLong() : null);

            return new PageResult<>(items, page, pageSize, total);
        } catch (ManagementApiException e) {
            throw e;
        } catch (Exception e) {
            throw new ManagementApiException("Failed to parse page from " + endpoint, e);
        }
    }

    private HttpResponse<String> send(String method, String endpoint, Object body) {
        String token = tokenManager.getAccessToken();
        try {
            return doSend(method, endpoint, body, token);
        } catch (AuthenticationException e) {
            LOG.debugf("Token rejected on %s %s, refreshing once", method, endpoint);
            return doSend(method, endpoint, body, tokenManager.refreshToken());
        }
    }

    private HttpResponse<String> doSend(String method, String endpoint, Object body, String token) {
        String url = config.baseUrl().replaceAll("/$", "") + endpoint;
        long start = System.currentTimeMillis();

        try {
            HttpRequest.Builder requestBuilder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .header("Authorization", "Bearer " + token)
                .header("Accept", "application/json")
                .header("Content-Type", "application/json")
                .timeout(Duration.ofSeconds(config.http().timeout()));

            if (body != null) {
                String jsonBody = objectMapper.writeValueAsString(body);
                requestBuilder.method(method, HttpRequest.BodyPublishers.ofString(jsonBody));
            } else {
                requestBuilder.method(method, HttpRequest.BodyPublishers.noBody());
            }

            HttpResponse<String> response = httpClient.send(
                requestBuilder.build(),
                HttpResponse.BodyHandlers.ofString()
            );

            LOG.debugf("%s %s -> %d (%d ms)", method, endpoint, response.statusCode(),
                System.currentTimeMillis() - start);

            checkStatus(response);
            return response;
        } catch (ManagementApiException e) {
            throw e;
        } catch (HttpTimeoutException e) {
            throw new ManagementApiException("Request timed out: " + method + " " + endpoint, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ManagementApiException("Interrupted: " + method + " " + endpoint, e);
        } catch (Exception e) {
            throw new ManagementApiException("Request failed: " + e.getMessage(), e);
        }
    }

    private void checkStatus(HttpResponse<String> response) {
        int status = response.statusCode();
        if (status < 400) {
            return;
        }

        Map<String, Object> data = parseErrorBody(response.body());
        String message = (String) data.getOrDefault("message", "HTTP " + status);
        String code = (String) data.get("code");

        if (status == 401) {
            throw AuthenticationException.tokenRejected();
        }

        if (status == 400 || status == 422) {
            throw ValidationException.fromResponse(status, data);
        }

        if (status == 429) {
            throw new RateLimitException(message, parseRetryAfter(response).orElse(null));
        }

        throw new ManagementApiException(message, status, code, null, data);
    }

    private Map<String, Object> parseErrorBody(String body) {
        if (body == null || body.isBlank()) {
            return Map.of();
        }
        try {
            return objectMapper.readValue(body, new TypeReference<Map<String, Object>>() {});
        } catch (Exception e) {
            return Map.of("message", body);
        }
    }

    private Optional<Duration> parseRetryAfter(HttpResponse<String> response) {
        return response.headers().firstValue("Retry-After")
            .flatMap(value -> {
                try {
                    return Optional.of(Duration.ofSeconds(Long.parseLong(value.trim())));
                } catch (NumberFormatException e) {
                    LOG.debugf("Ignoring non-numeric Retry-After header [%s]", value);
                    return Optional.empty();
                }
            });
    }

    public String getBaseUrl() {
        return config.baseUrl();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
