package tech.rolesync.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.rolesync.sdk.client.ManagementApiClient;
import tech.rolesync.sdk.dto.Application;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.dto.SignInExperience;
import tech.rolesync.sdk.exception.ManagementApiException;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Application registrations, including third-party branding and consent scopes.
 */
public class Applications {

    public static final String TYPE_TRADITIONAL = "Traditional";

    private static final String BASE = "/api/applications";

    private final ManagementApiClient client;

    public Applications(ManagementApiClient client) {
        this.client = client;
    }

    /**
     * List one page of applications of every type.
     */
    public PageResult<Application> list(int page, int pageSize) {
        return client.requestPage(BASE, page, pageSize, Application.class);
    }

    public Application create(CreateApplicationRequest request) {
        var response = client.request("POST", BASE, request,
            new TypeReference<Map<String, Object>>() {});
        return client.getObjectMapper().convertValue(response, Application.class);
    }

    public void update(String id, UpdateApplicationRequest request) {
        client.requestVoid("PATCH", BASE + "/" + id, request);
    }

    public void delete(String id) {
        client.requestVoid("DELETE", BASE + "/" + id, null);
    }

    /**
     * Get the application's sign-in experience, or empty when none is configured.
     */
    public Optional<SignInExperience> getSignInExperience(String id) {
        try {
            var response = client.request("GET", BASE + "/" + id + "/sign-in-experience", null,
                new TypeReference<Map<String, Object>>() {});
            if (response == null) {
                return Optional.empty();
            }
            return Optional.of(client.getObjectMapper().convertValue(response, SignInExperience.class));
        } catch (ManagementApiException e) {
            if (e.getStatusCode() == 404) {
                return Optional.empty();
            }
            throw e;
        }
    }

    public void putSignInExperience(String id, SignInExperience experience) {
        client.requestVoid("PUT", BASE + "/" + id + "/sign-in-experience", experience);
    }

    /**
     * Get the user scopes an application asks consent for.
     */
    public List<String> getUserConsentScopes(String id) {
        try {
            var response = client.request("GET", BASE + "/" + id + "/user-consent-scopes", null,
                new TypeReference<Map<String, Object>>() {});
            if (response == null) {
                return List.of();
            }
            @SuppressWarnings("unchecked")
            var scopes = (List<String>) response.getOrDefault("userScopes", List.of());
            return scopes;
        } catch (ManagementApiException e) {
            if (e.getStatusCode() == 404) {
                return List.of();
            }
            throw e;
        }
    }

    public void putUserConsentScopes(String id, List<String> userScopes) {
        client.requestVoid("POST", BASE + "/" + id + "/user-consent-scopes",
            new ConsentScopesRequest(userScopes));
    }

    // Request DTOs

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CreateApplicationRequest(
        String name,
        String description,
        String type,
        @JsonProperty("isThirdParty") boolean isThirdParty,
        Application.OidcClientMetadata oidcClientMetadata,
        Map<String, Object> customData
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UpdateApplicationRequest(
        String name,
        String description,
        Application.OidcClientMetadata oidcClientMetadata,
        Map<String, Object> customData
    ) {}

    public record ConsentScopesRequest(
        List<String> userScopes
    ) {}
}
