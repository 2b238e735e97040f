package tech.rolesync.engine.provider;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rolesync.engine.config.EngineConfig;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.sdk.client.ManagementApiClient;
import tech.rolesync.sdk.client.resources.ApiResources;
import tech.rolesync.sdk.client.resources.Applications;
import tech.rolesync.sdk.client.resources.OrganizationRoles;
import tech.rolesync.sdk.client.resources.OrganizationScopes;
import tech.rolesync.sdk.client.resources.Roles;
import tech.rolesync.sdk.dto.ApiResource;
import tech.rolesync.sdk.dto.Application;
import tech.rolesync.sdk.dto.PageResult;
import tech.rolesync.sdk.dto.Role;
import tech.rolesync.sdk.dto.Scope;
import tech.rolesync.sdk.dto.SignInExperience;
import tech.rolesync.sdk.exception.ManagementApiException;
import tech.rolesync.sdk.exception.RateLimitException;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.function.Supplier;

/**
 * {@link IdentityProviderClient} backed by the management API SDK.
 *
 * <p>SDK exceptions are translated into {@link ProviderException} through the
 * {@link ProviderErrorTable}, so callers never see transport types.
 */
@ApplicationScoped
public class ManagementApiIdentityProviderClient implements IdentityProviderClient {

    private static final Logger LOG = Logger.getLogger(ManagementApiIdentityProviderClient.class);

    private final ManagementApiClient api;
    private final ProviderErrorTable errorTable;

    @Inject
    public ManagementApiIdentityProviderClient(ManagementApiClient api, EngineConfig config) {
        this(api, new ProviderErrorTable(config.errorCodes()));
    }

    public ManagementApiIdentityProviderClient(ManagementApiClient api, ProviderErrorTable errorTable) {
        this.api = api;
        this.errorTable = errorTable;
    }

    // Resources

    @Override
    public Page<RemoteResource> listResources(int page, int pageSize) {
        return call("list resources",
            () -> toPage(api.resources().list(page, pageSize), this::toRemoteResource));
    }

    @Override
    public RemoteResource createResource(String name, String indicator, int accessTokenTtl) {
        return call("create resource " + name, () -> toRemoteResource(api.resources().create(
            new ApiResources.CreateResourceRequest(name, indicator, accessTokenTtl))));
    }

    @Override
    public void updateResource(String resourceId, String name, int accessTokenTtl) {
        run("update resource " + name, () -> api.resources().update(resourceId,
            new ApiResources.UpdateResourceRequest(name, accessTokenTtl)));
    }

    @Override
    public void deleteResource(String resourceId) {
        run("delete resource " + resourceId, () -> api.resources().delete(resourceId));
    }

    @Override
    public Page<RemoteScope> listResourceScopes(String resourceId, int page, int pageSize) {
        return call("list scopes of resource " + resourceId,
            () -> toPage(api.resources().listScopes(resourceId, page, pageSize), this::toRemoteScope));
    }

    @Override
    public RemoteScope createResourceScope(String resourceId, String name, String description) {
        return call("create scope " + name, () -> toRemoteScope(api.resources().createScope(resourceId,
            new ApiResources.CreateScopeRequest(name, description))));
    }

    @Override
    public void deleteResourceScope(String resourceId, String scopeId) {
        run("delete scope " + scopeId, () -> api.resources().deleteScope(resourceId, scopeId));
    }

    // Organization scopes

    @Override
    public Page<RemoteScope> listOrganizationScopes(int page, int pageSize) {
        return call("list organization scopes",
            () -> toPage(api.organizationScopes().list(page, pageSize), this::toRemoteScope));
    }

    @Override
    public RemoteScope createOrganizationScope(String name, String description) {
        return call("create organization scope " + name, () -> toRemoteScope(api.organizationScopes().create(
            new OrganizationScopes.OrganizationScopeRequest(name, description))));
    }

    @Override
    public void updateOrganizationScope(String scopeId, String name, String description) {
        run("update organization scope " + name, () -> api.organizationScopes().update(scopeId,
            new OrganizationScopes.OrganizationScopeRequest(name, description)));
    }

    @Override
    public void deleteOrganizationScope(String scopeId) {
        run("delete organization scope " + scopeId, () -> api.organizationScopes().delete(scopeId));
    }

    // Roles

    @Override
    public Page<RemoteRole> listRoles(RoleType type, int page, int pageSize) {
        if (type == RoleType.ORGANIZATION) {
            return call("list organization roles", () -> toPage(api.organizationRoles().list(page, pageSize),
                r -> new RemoteRole(r.id(), r.name(), r.description(), false)));
        }
        return call("list user roles", () -> toPage(api.roles().list(Roles.TYPE_USER, page, pageSize),
            this::toRemoteRole));
    }

    @Override
    public RemoteRole createRole(RoleType type, String name, String description) {
        if (type == RoleType.ORGANIZATION) {
            return call("create organization role " + name, () -> {
                var created = api.organizationRoles().create(
                    new OrganizationRoles.OrganizationRoleRequest(name, description));
                return new RemoteRole(created.id(), created.name(), created.description(), false);
            });
        }
        return call("create user role " + name, () -> toRemoteRole(api.roles().create(
            new Roles.CreateRoleRequest(name, description, Roles.TYPE_USER))));
    }

    @Override
    public void updateRole(RoleType type, String roleId, String description) {
        if (type == RoleType.ORGANIZATION) {
            run("update organization role " + roleId, () -> api.organizationRoles().update(roleId,
                new OrganizationRoles.OrganizationRoleRequest(null, description)));
        } else {
            run("update user role " + roleId, () -> api.roles().update(roleId,
                new Roles.UpdateRoleRequest(description)));
        }
    }

    @Override
    public void deleteRole(RoleType type, String roleId) {
        if (type == RoleType.ORGANIZATION) {
            run("delete organization role " + roleId, () -> api.organizationRoles().delete(roleId));
        } else {
            run("delete user role " + roleId, () -> api.roles().delete(roleId));
        }
    }

    @Override
    public Page<RemoteScope> listRoleScopes(RoleType type, String roleId, int page, int pageSize) {
        if (type == RoleType.ORGANIZATION) {
            return call("list scopes of organization role " + roleId,
                () -> toPage(api.organizationRoles().listScopes(roleId, page, pageSize), this::toRemoteScope));
        }
        return call("list scopes of user role " + roleId,
            () -> toPage(api.roles().listScopes(roleId, page, pageSize), this::toRemoteScope));
    }

    @Override
    public void assignRoleScopes(RoleType type, String roleId, List<String> scopeIds) {
        if (type == RoleType.ORGANIZATION) {
            run("assign scopes to organization role " + roleId,
                () -> api.organizationRoles().assignScopes(roleId, scopeIds));
        } else {
            run("assign scopes to user role " + roleId, () -> api.roles().assignScopes(roleId, scopeIds));
        }
    }

    @Override
    public void removeRoleScope(RoleType type, String roleId, String scopeId) {
        if (type == RoleType.ORGANIZATION) {
            run("remove scope from organization role " + roleId,
                () -> api.organizationRoles().removeScope(roleId, scopeId));
        } else {
            run("remove scope from user role " + roleId, () -> api.roles().removeScope(roleId, scopeId));
        }
    }

    // Applications

    @Override
    public Page<RemoteApplication> listThirdPartyApplications(int page, int pageSize) {
        return call("list applications", () -> {
            PageResult<Application> result = api.applications().list(page, pageSize);
            List<RemoteApplication> thirdParty = result.items().stream()
                .filter(Application::isThirdParty)
                .map(this::toRemoteApplication)
                .toList();
            return new Page<>(thirdParty, page, result.hasNext());
        });
    }

    @Override
    public Optional<String> getApplicationDisplayName(String applicationId) {
        return call("get sign-in experience of " + applicationId,
            () -> api.applications().getSignInExperience(applicationId).map(SignInExperience::displayName));
    }

    @Override
    public List<String> listApplicationConsentScopes(String applicationId) {
        return call("get consent scopes of " + applicationId,
            () -> api.applications().getUserConsentScopes(applicationId));
    }

    @Override
    public RemoteApplication createApplication(ApplicationSpec spec) {
        return call("create application " + spec.name(), () -> toRemoteApplication(api.applications().create(
            new Applications.CreateApplicationRequest(
                spec.name(),
                spec.description(),
                Applications.TYPE_TRADITIONAL,
                true,
                new Application.OidcClientMetadata(spec.redirectUris(), spec.postLogoutRedirectUris()),
                spec.customData()
            ))));
    }

    @Override
    public void updateApplication(String applicationId, ApplicationSpec spec) {
        run("update application " + spec.name(), () -> api.applications().update(applicationId,
            new Applications.UpdateApplicationRequest(
                spec.name(),
                spec.description(),
                new Application.OidcClientMetadata(spec.redirectUris(), spec.postLogoutRedirectUris()),
                spec.customData()
            )));
    }

    @Override
    public void setApplicationDisplayName(String applicationId, String displayName) {
        run("set display name of " + applicationId, () -> api.applications().putSignInExperience(
            applicationId, new SignInExperience(displayName)));
    }

    @Override
    public void setApplicationConsentScopes(String applicationId, List<String> scopes) {
        run("set consent scopes of " + applicationId,
            () -> api.applications().putUserConsentScopes(applicationId, scopes));
    }

    @Override
    public void updateApplicationCustomData(String applicationId, Map<String, Object> customData) {
        run("update custom data of " + applicationId, () -> api.applications().update(applicationId,
            new Applications.UpdateApplicationRequest(null, null, null, customData)));
    }

    @Override
    public void deleteApplication(String applicationId) {
        run("delete application " + applicationId, () -> api.applications().delete(applicationId));
    }

    // Translation

    private <T> T call(String action, Supplier<T> supplier) {
        try {
            return supplier.get();
        } catch (ManagementApiException e) {
            throw translate(action, e);
        }
    }

    private void run(String action, Runnable runnable) {
        call(action, () -> {
            runnable.run();
            return null;
        });
    }

    ProviderException translate(String action, ManagementApiException e) {
        Duration retryAfter = e instanceof RateLimitException rle ? rle.getRetryAfter().orElse(null) : null;
        ProviderError error = errorTable.classify(
            e.getStatusCode(), e.getErrorCode(), action + ": " + e.getMessage(), retryAfter);
        LOG.debugf("%s failed with %s (status %d, code %s)", action, error.kind(), e.getStatusCode(), e.getErrorCode());
        return new ProviderException(error, e);
    }

    private static <S, T> Page<T> toPage(PageResult<S> result, Function<S, T> mapper) {
        return new Page<>(result.items().stream().map(mapper).toList(), result.page(), result.hasNext());
    }

    private RemoteResource toRemoteResource(ApiResource r) {
        return new RemoteResource(r.id(), r.name(), r.indicator(), r.isDefault(), r.accessTokenTtl());
    }

    private RemoteScope toRemoteScope(Scope s) {
        return new RemoteScope(s.id(), s.name(), s.description(), s.resourceId());
    }

    private RemoteRole toRemoteRole(Role r) {
        return new RemoteRole(r.id(), r.name(), r.description(), r.isDefault());
    }

    private RemoteApplication toRemoteApplication(Application a) {
        var oidc = a.oidcClientMetadata();
        return new RemoteApplication(
            a.id(),
            a.name(),
            a.description(),
            oidc != null ? oidc.redirectUris() : List.of(),
            oidc != null ? oidc.postLogoutRedirectUris() : List.of(),
            a.customData()
        );
    }
}
