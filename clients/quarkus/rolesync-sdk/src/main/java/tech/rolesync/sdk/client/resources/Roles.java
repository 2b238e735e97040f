package tech.rolesync.sdk.client.resources;

import com.fasterxml.jackson.core.type.TypeReference;
import tech.rolesync.sdk.client.ManagementApiClient;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.dto.Role;
import tech.rolesync.sdk.dto.Scope;

import java.util.List;
import java.util.Map;

/**
 * Tenant-level roles and their resource scope bindings.
 */
public class Roles {

    public static final String TYPE_USER = "User";

    private static final String BASE = "/api/roles";

    private final ManagementApiClient client;

    public Roles(ManagementApiClient client) {
        this.client = client;
    }

    /**
     * List one page of roles of the given type.
     */
    public PageResult<Role> list(String type, int page, int pageSize) {
        return client.requestPage(BASE + "?type=" + type, page, pageSize, Role.class);
    }

    public Role create(CreateRoleRequest request) {
        var response = client.request("POST", BASE, request,
            new TypeReference<Map<String, Object>>() {});
        return client.getObjectMapper().convertValue(response, Role.class);
    }

    public void update(String id, UpdateRoleRequest request) {
        client.requestVoid("PATCH", BASE + "/" + id, request);
    }

    public void delete(String id) {
        client.requestVoid("DELETE", BASE + "/" + id, null);
    }

    /**
     * List one page of the scopes bound to a role.
     */
    public PageResult<Scope> listScopes(String roleId, int page, int pageSize) {
        return client.requestPage(BASE + "/" + roleId + "/scopes", page, pageSize, Scope.class);
    }

    /**
     * Bind scopes to a role. Scopes are appended in the given order.
     */
    public void assignScopes(String roleId, List<String> scopeIds) {
        client.requestVoid("POST", BASE + "/" + roleId + "/scopes", new AssignScopesRequest(scopeIds));
    }

    public void removeScope(String roleId, String scopeId) {
        client.requestVoid("DELETE", BASE + "/" + roleId + "/scopes/" + scopeId, null);
    }

    // Request DTOs

    public record CreateRoleRequest(
        String name,
        String description,
        String type
    ) {}

    public record UpdateRoleRequest(
        String description
    ) {}

    public record AssignScopesRequest(
        List<String> scopeIds
    ) {}
}
