package tech.rolesync.engine.state;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.rolesync.engine.ReconcilerContext;
import tech.rolesync.engine.errors.StateLoadException;
import tech.rolesync.engine.exec.RetryingCaller;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.provider.IdentityProviderClient;
import tech.rolesync.engine.provider.Page;
import tech.rolesync.engine.provider.RemoteApplication;
import tech.rolesync.engine.provider.RemoteResource;
import tech.rolesync.engine.provider.RemoteRole;
import tech.rolesync.engine.provider.RemoteScope;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Reads the complete actual state from the provider.
 *
 * <p>Every list is read to its last page. Transient failures are retried with
 * the run's retry policy; any category that still fails aborts the whole read.
 */
@ApplicationScoped
public class RemoteStateReader {

    private static final Logger LOG = Logger.getLogger(RemoteStateReader.class);

    @FunctionalInterface
    interface PageFetcher<T> {
        Page<T> fetch(int page, int pageSize);
    }

    /**
     * Fetch actual state.
     *
     * @param includeApplications false skips third-party applications entirely
     * @throws StateLoadException if any category cannot be read
     */
    public ActualState fetch(ReconcilerContext ctx, boolean includeApplications) {
        IdentityProviderClient client = ctx.client();
        long start = System.currentTimeMillis();

        Map<String, ResourceState> resources = new LinkedHashMap<>();
        for (RemoteResource resource : readAll(ctx, "resources", client::listResources)) {
            List<RemoteScope> scopes = readAll(ctx, "scopes of resource " + resource.name(),
                (page, size) -> client.listResourceScopes(resource.id(), page, size));
            resources.putIfAbsent(resource.name(), new ResourceState(resource, scopes));
        }

        Map<String, RemoteScope> organizationScopes = new LinkedHashMap<>();
        for (RemoteScope scope : readAll(ctx, "organization scopes", client::listOrganizationScopes)) {
            organizationScopes.putIfAbsent(scope.name(), scope);
        }

        Map<String, RoleState> organizationRoles = readRoles(ctx, RoleType.ORGANIZATION);
        Map<String, RoleState> userRoles = readRoles(ctx, RoleType.USER);

        Map<String, ApplicationState> applications = new LinkedHashMap<>();
        if (includeApplications) {
            for (RemoteApplication app : readAll(ctx, "third-party applications",
                    client::listThirdPartyApplications)) {
                String displayName = readOne(ctx, "branding of " + app.name(),
                    () -> client.getApplicationDisplayName(app.id()).orElse(null));
                List<String> consentScopes = readOne(ctx, "consent scopes of " + app.name(),
                    () -> client.listApplicationConsentScopes(app.id()));
                applications.putIfAbsent(app.name(), new ApplicationState(app, displayName, consentScopes));
            }
        }

        LOG.infof("Loaded actual state in %d ms: %d resources, %d organization scopes, "
                + "%d organization roles, %d user roles, %d applications",
            System.currentTimeMillis() - start, resources.size(), organizationScopes.size(),
            organizationRoles.size(), userRoles.size(), applications.size());

        return new ActualState(resources, organizationScopes, organizationRoles, userRoles, applications);
    }

    private Map<String, RoleState> readRoles(ReconcilerContext ctx, RoleType type) {
        IdentityProviderClient client = ctx.client();
        Map<String, RoleState> roles = new LinkedHashMap<>();
        for (RemoteRole role : readAll(ctx, type.label() + " roles",
                (page, size) -> client.listRoles(type, page, size))) {
            List<RemoteScope> scopes = readAll(ctx, "scopes of " + type.label() + " role " + role.name(),
                (page, size) -> client.listRoleScopes(type, role.id(), page, size));
            roles.putIfAbsent(ActualState.roleKey(role.name()), new RoleState(type, role, scopes));
        }
        return roles;
    }

    <T> List<T> readAll(ReconcilerContext ctx, String category, PageFetcher<T> fetcher) {
        int pageSize = ctx.settings().pageSize();
        int maxPages = ctx.settings().maxPages();
        List<T> items = new ArrayList<>();

        for (int page = 1; ; page++) {
            final int current = page;
            Page<T> result = readOne(ctx, category, () -> fetcher.fetch(current, pageSize));
            items.addAll(result.items());
            if (!result.hasMore()) {
                LOG.debugf("Read %d %s over %d page(s)", (Object) items.size(), category, page);
                return items;
            }
            if (page >= maxPages) {
                throw new StateLoadException(category,
                    "still more items after " + maxPages + " pages", null);
            }
        }
    }

    private <T> T readOne(ReconcilerContext ctx, String category, Supplier<T> call) {
        RetryingCaller.Outcome<T> outcome = ctx.retryingCaller().call(category, call);
        if (outcome.failure() != null) {
            throw new StateLoadException(category, outcome.failure().getMessage(), outcome.failure());
        }
        return outcome.value();
    }
}
