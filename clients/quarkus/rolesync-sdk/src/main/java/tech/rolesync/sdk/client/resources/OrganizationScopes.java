package tech.rolesync.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.rolesync.sdk.client.ManagementApiClient;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.dto.Scope;

import java.util.Map;

/**
 * Organization-level permission scopes.
 */
public class OrganizationScopes {

    private static final String BASE = "/api/organization-scopes";

    private final ManagementApiClient client;

    public OrganizationScopes(ManagementApiClient client) {
        this.client = client;
    }

    public PageResult<Scope> list(int page, int pageSize) {
        return client.requestPage(BASE, page, pageSize, Scope.class);
    }

    public Scope create(OrganizationScopeRequest request) {
        var response = client.request("POST", BASE, request,
            new TypeReference<Map<String, Object>>() {});
        return client.getObjectMapper().convertValue(response, Scope.class);
    }

    public void update(String id, OrganizationScopeRequest request) {
        client.requestVoid("PATCH", BASE + "/" + id, request);
    }

    public void delete(String id) {
        client.requestVoid("DELETE", BASE + "/" + id, null);
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OrganizationScopeRequest(
        String name,
        String description
    ) {}
}
