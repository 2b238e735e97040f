package tech.rolesync.sdk.client.resources;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.type.TypeReference;
import tech.rolesync.sdk.client.ManagementApiClient;
import tech.rolesync.sdk.dto.OrganizationRole;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.dto.Scope;

import java.util.List;
import java.util.Map;

/**
 * Organization role templates and their organization scope bindings.
 */
public class OrganizationRoles {

    private static final String BASE = "/api/organization-roles";

    private final ManagementApiClient client;

    public OrganizationRoles(ManagementApiClient client) {
        this.client = client;
    }

    public PageResult<OrganizationRole> list(int page, int pageSize) {
        return client.requestPage(BASE, page, pageSize, OrganizationRole.class);
    }

    public OrganizationRole create(OrganizationRoleRequest request) {
        var response = client.request("POST", BASE, request,
            new TypeReference<Map<String, Object>>() {});
        return client.getObjectMapper().convertValue(response, OrganizationRole.class);
    }

    public void update(String id, OrganizationRoleRequest request) {
        client.requestVoid("PATCH", BASE + "/" + id, request);
    }

    public void delete(String id) {
        client.requestVoid("DELETE", BASE + "/" + id, null);
    }

    public PageResult<Scope> listScopes(String roleId, int page, int pageSize) {
        return client.requestPage(BASE + "/" + roleId + "/scopes", page, pageSize, Scope.class);
    }

    public void assignScopes(String roleId, List<String> organizationScopeIds) {
        client.requestVoid("POST", BASE + "/" + roleId + "/scopes",
            new AssignOrganizationScopesRequest(organizationScopeIds));
    }

    public void removeScope(String roleId, String organizationScopeId) {
        client.requestVoid("DELETE", BASE + "/" + roleId + "/scopes/" + organizationScopeId, null);
    }

    // Request DTOs

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OrganizationRoleRequest(
        String name,
        String description
    ) {}

    public record AssignOrganizationScopesRequest(
        List<String> organizationScopeIds
    ) {}
}
