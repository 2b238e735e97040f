package tech.rolesync.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.rolesync.sdk.client.ManagementApiClient;
import tech.rolesync.sdk.dto.ApiResource;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.dto.Scope;

import java.util.Map;

/**
 * API resources and the scopes they own.
 */
public class ApiResources {

    private static final String BASE = "/api/resources";

    private final ManagementApiClient client;

    public ApiResources(ManagementApiClient client) {
        this.client = client;
    }

    /**
     * List one page of API resources.
     */
    public PageResult<ApiResource> list(int page, int pageSize) {
        return client.requestPage(BASE, page, pageSize, ApiResource.class);
    }

    /**
     * Register a new API resource.
     */
    public ApiResource create(CreateResourceRequest request) {
        var response = client.request("POST", BASE, request,
            new TypeReference<Map<String, Object>>() {});
        return client.getObjectMapper().convertValue(response, ApiResource.class);
    }

    /**
     * Update a resource's mutable fields. The indicator cannot be changed.
     */
    public void update(String id, UpdateResourceRequest request) {
        client.requestVoid("PATCH", BASE + "/" + id, request);
    }

    /**
     * Delete an API resource together with its scopes.
     */
    public void delete(String id) {
        client.requestVoid("DELETE", BASE + "/" + id, null);
    }

    public PageResult<Scope> listScopes(String resourceId, int page, int pageSize) {
        return client.requestPage(BASE + "/" + resourceId + "/scopes", page, pageSize, Scope.class);
    }

    public Scope createScope(String resourceId, CreateScopeRequest request) {
        var response = client.request("POST", BASE + "/" + resourceId + "/scopes", request,
            new TypeReference<Map<String, Object>>() {});
        return client.getObjectMapper().convertValue(response, Scope.class);
    }

    public void deleteScope(String resourceId, String scopeId) {
        client.requestVoid("DELETE", BASE + "/" + resourceId + "/scopes/" + scopeId, null);
    }

    // Request DTOs

    public record CreateResourceRequest(
        String name,
        String indicator,
        Integer accessTokenTtl
    ) {}

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record UpdateResourceRequest(
        String name,
        Integer accessTokenTtl
    ) {}

    public record CreateScopeRequest(
        String name,
        String description
    ) {}
}
