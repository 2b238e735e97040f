package tech.rolesync.engine.provider;

import tech.rolesync.engine.model.RoleType;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Typed access to the identity provider's RBAC entities.
 *
 * <p>Every method either returns normally or throws {@link ProviderException}.
 * List methods are paged; pages are numbered from 1.
 *
 * <p>Bindings of organization roles refer to organization scopes. Bindings of
 * user roles refer to resource scopes.
 */
public interface IdentityProviderClient {

    // Resources and resource scopes

    Page<RemoteResource> listResources(int page, int pageSize);

    RemoteResource createResource(String name, String indicator, int accessTokenTtl);

    void updateResource(String resourceId, String name, int accessTokenTtl);

    void deleteResource(String resourceId);

    Page<RemoteScope> listResourceScopes(String resourceId, int page, int pageSize);

    RemoteScope createResourceScope(String resourceId, String name, String description);

    void deleteResourceScope(String resourceId, String scopeId);

    // Organization scopes

    Page<RemoteScope> listOrganizationScopes(int page, int pageSize);

    RemoteScope createOrganizationScope(String name, String description);

    void updateOrganizationScope(String scopeId, String name, String description);

    void deleteOrganizationScope(String scopeId);

    // Roles and their scope bindings

    Page<RemoteRole> listRoles(RoleType type, int page, int pageSize);

    RemoteRole createRole(RoleType type, String name, String description);

    void updateRole(RoleType type, String roleId, String description);

    void deleteRole(RoleType type, String roleId);

    Page<RemoteScope> listRoleScopes(RoleType type, String roleId, int page, int pageSize);

    /**
     * Bind scopes to a role. Scopes are appended in list order.
     */
    void assignRoleScopes(RoleType type, String roleId, List<String> scopeIds);

    void removeRoleScope(RoleType type, String roleId, String scopeId);

    // Third-party applications

    /**
     * List third-party applications only; first-party applications are never returned.
     */
    Page<RemoteApplication> listThirdPartyApplications(int page, int pageSize);

    Optional<String> getApplicationDisplayName(String applicationId);

    List<String> listApplicationConsentScopes(String applicationId);

    RemoteApplication createApplication(ApplicationSpec spec);

    void updateApplication(String applicationId, ApplicationSpec spec);

    void setApplicationDisplayName(String applicationId, String displayName);

    void setApplicationConsentScopes(String applicationId, List<String> scopes);

    /**
     * Replace the application's custom data.
     */
    void updateApplicationCustomData(String applicationId, Map<String, Object> customData);

    void deleteApplication(String applicationId);
}
