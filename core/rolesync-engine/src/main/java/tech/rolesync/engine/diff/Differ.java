package tech.rolesync.engine.diff;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import tech.rolesync.engine.ReconcileOptions;
import tech.rolesync.engine.config.EngineConfig;
import tech.rolesync.engine.config.EngineSettings;
import tech.rolesync.engine.guard.ProtectionPolicy;
import tech.rolesync.engine.model.ApplicationDefinition;
import tech.rolesync.engine.model.DesiredState;
import tech.rolesync.engine.model.PermissionRef;
import tech.rolesync.engine.model.ResourceDefinition;
import tech.rolesync.engine.model.RoleDefinition;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.OperationPayload;
import tech.rolesync.engine.provider.ApplicationSpec;
import tech.rolesync.engine.provider.RemoteResource;
import tech.rolesync.engine.provider.RemoteScope;
import tech.rolesync.engine.report.ReportItem;
import tech.rolesync.engine.state.ActualState;
import tech.rolesync.engine.state.ApplicationState;
import tech.rolesync.engine.state.ResourceState;
import tech.rolesync.engine.state.RoleState;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the changes that move actual state to desired state.
 *
 * <p>Pure and synchronous: no provider calls, no clock. Entities are matched by
 * natural key (resource name, scope name, lower-cased role id, application name)
 * and compared field by field.
 */
@ApplicationScoped
public class Differ {

    private static final Logger LOG = Logger.getLogger(Differ.class);

    static final String ACCESS_CONTROL_KEY = "access_control";
    static final String LOGIN_URL_KEY = "login_url";

    private final EngineSettings settings;

    @Inject
    public Differ(EngineConfig config) {
        this(EngineSettings.from(config));
    }

    public Differ(EngineSettings settings) {
        this.settings = settings;
    }

    public DiffResult diff(DesiredState desired, ActualState actual, ReconcileOptions options) {
        Run run = new Run(desired, actual, options);
        run.resources();
        run.organizationScopes();
        for (RoleType type : RoleType.values()) {
            run.roles(type);
        }
        for (RoleType type : RoleType.values()) {
            run.bindings(type);
        }
        run.applications();

        DiffResult result = new DiffResult(run.changes, run.unchanged, run.skipped);
        LOG.debugf("Diff: %d changes, %d skipped", result.changes().size(), result.skipped().size());
        return result;
    }

    /**
     * Mutable working set of one diff.
     */
    private final class Run {

        private final DesiredState desired;
        private final ActualState actual;
        private final ReconcileOptions options;
        private final ProtectionPolicy protection = settings.protection();

        private final List<Change> changes = new ArrayList<>();
        private final Map<EntityType, Integer> unchanged = new EnumMap<>(EntityType.class);
        private final List<ReportItem> skipped = new ArrayList<>();

        // Scope names usable for bindings after this run, and those this run creates
        private final Set<String> availableScopes = new HashSet<>();
        private final Set<String> createdScopes = new HashSet<>();
        private final Set<String> availableOrgScopes = new HashSet<>();
        private final Set<String> createdOrgScopes = new HashSet<>();
        private final Map<RoleType, Set<String>> availableRoles = new EnumMap<>(RoleType.class);
        private final Map<RoleType, Set<String>> createdRoles = new EnumMap<>(RoleType.class);

        // Resource ids whose scopes the engine may bind and unbind
        private final Set<String> managedResourceIds = new HashSet<>();

        // resource:action names declared by the desired resources
        private final Set<String> declaredScopes = new HashSet<>();

        Run(DesiredState desired, ActualState actual, ReconcileOptions options) {
            this.desired = desired;
            this.actual = actual;
            this.options = options;
            for (ResourceDefinition def : desired.resources()) {
                if (isBlank(def.name())) {
                    continue;
                }
                def.actions().stream().filter(a -> !isBlank(a)).forEach(a -> declaredScopes.add(def.scopeName(a)));
            }
            for (RoleType type : RoleType.values()) {
                availableRoles.put(type, new HashSet<>());
                createdRoles.put(type, new HashSet<>());
            }
        }

        // Resources and scopes

        void resources() {
            for (ResourceState state : actual.resources().values()) {
                RemoteResource r = state.resource();
                if (protection.checkResource(r.name(), r.indicator(), r.isDefault()).isEmpty()) {
                    managedResourceIds.add(r.id());
                    state.scopes().forEach(s -> availableScopes.add(s.name()));
                }
            }

            if (options.skipResources()) {
                return;
            }

            Map<String, ResourceDefinition> wanted = new LinkedHashMap<>();
            for (ResourceDefinition def : desired.resources()) {
                wanted.putIfAbsent(def.name(), def);
            }

            for (ResourceDefinition def : wanted.values()) {
                EntityRef ref = EntityRef.of(EntityType.RESOURCE, def.name());
                String indicator = settings.indicatorFor(def.name());
                int ttl = def.accessTokenTtl() != null ? def.accessTokenTtl() : settings.accessTokenTtl();
                ResourceState existing = actual.resources().get(def.name());

                if (existing == null) {
                    changes.add(Change.create(ref,
                        new OperationPayload.Resource(def.name(), indicator, ttl, false),
                        List.of(), "Create resource " + def.name()));
                    for (String action : new LinkedHashSet<>(def.actions())) {
                        createScope(def, action, indicator, false, List.of(ref));
                    }
                    continue;
                }

                RemoteResource remote = existing.resource();
                if (settings.comparesIndicators() && !Objects.equals(remote.indicator(), indicator)) {
                    skipped.add(ReportItem.of(ref, "indicator is " + remote.indicator()
                        + " but expected " + indicator + "; indicators cannot be changed in place"));
                }
                if (!Objects.equals(remote.accessTokenTtl(), ttl)) {
                    changes.add(Change.update(ref,
                        new OperationPayload.Resource(def.name(), remote.indicator(), ttl, remote.isDefault()),
                        List.of(), "Update resource " + def.name() + " token TTL to " + ttl + "s"));
                } else {
                    countUnchanged(EntityType.RESOURCE);
                }

                Map<String, RemoteScope> remoteScopes = existing.scopesByName();
                Set<String> wantedScopes = new LinkedHashSet<>();
                for (String action : def.actions()) {
                    String scopeName = def.scopeName(action);
                    if (!wantedScopes.add(scopeName)) {
                        continue;
                    }
                    if (remoteScopes.containsKey(scopeName)) {
                        countUnchanged(EntityType.SCOPE);
                    } else {
                        createScope(def, action, remote.indicator(), remote.isDefault(), List.of());
                    }
                }
                for (RemoteScope scope : existing.scopes()) {
                    if (!wantedScopes.contains(scope.name())) {
                        deleteScope(remote, scope);
                    }
                }
            }

            for (ResourceState state : actual.resources().values()) {
                RemoteResource remote = state.resource();
                if (wanted.containsKey(remote.name())) {
                    continue;
                }
                List<EntityRef> scopeRefs = new ArrayList<>();
                for (RemoteScope scope : state.scopes()) {
                    scopeRefs.add(deleteScope(remote, scope));
                }
                changes.add(Change.delete(EntityRef.of(EntityType.RESOURCE, remote.name()),
                    new OperationPayload.Resource(remote.name(), remote.indicator(),
                        remote.accessTokenTtl() != null ? remote.accessTokenTtl() : 0, remote.isDefault()),
                    scopeRefs, "Delete resource " + remote.name()));
            }
        }

        private void createScope(ResourceDefinition def, String action, String ownerIndicator,
                                 boolean ownerDefault, List<EntityRef> dependsOn) {
            String scopeName = def.scopeName(action);
            changes.add(Change.create(EntityRef.of(EntityType.SCOPE, scopeName),
                new OperationPayload.Scope(def.name(), scopeName, "Permission to " + action + " " + def.name(),
                    ownerIndicator, ownerDefault),
                dependsOn, "Create scope " + scopeName));
            availableScopes.add(scopeName);
            createdScopes.add(scopeName);
        }

        private EntityRef deleteScope(RemoteResource owner, RemoteScope scope) {
            EntityRef ref = EntityRef.of(EntityType.SCOPE, scope.name());
            changes.add(Change.delete(ref,
                new OperationPayload.Scope(owner.name(), scope.name(), scope.description(),
                    owner.indicator(), owner.isDefault()),
                List.of(), "Delete scope " + scope.name() + " of " + owner.name()));
            return ref;
        }

        // Organization scopes

        void organizationScopes() {
            for (RemoteScope scope : actual.organizationScopes().values()) {
                if (!protection.isReservedName(scope.name())) {
                    availableOrgScopes.add(scope.name());
                }
            }

            if (options.skipPermissions()) {
                return;
            }

            // Permissions that name no declared scope are reported with the role bindings
            Map<String, PermissionRef> wanted = new LinkedHashMap<>();
            for (RoleType type : RoleType.values()) {
                for (RoleDefinition role : desired.roles(type)) {
                    role.permissions().stream()
                        .filter(p -> declaredScopes.contains(p.id()))
                        .forEach(p -> wanted.putIfAbsent(p.id(), p));
                }
            }

            for (PermissionRef permission : wanted.values()) {
                EntityRef ref = EntityRef.of(EntityType.ORGANIZATION_SCOPE, permission.id());
                String description = "Organization scope: " + permission.displayName();
                RemoteScope existing = actual.organizationScopes().get(permission.id());
                if (existing == null) {
                    changes.add(Change.create(ref,
                        new OperationPayload.OrganizationScope(permission.id(), description),
                        List.of(), "Create organization scope " + permission.id()));
                    availableOrgScopes.add(permission.id());
                    createdOrgScopes.add(permission.id());
                } else if (!Objects.equals(existing.description(), description)) {
                    changes.add(Change.update(ref,
                        new OperationPayload.OrganizationScope(permission.id(), description),
                        List.of(), "Update organization scope " + permission.id()));
                } else {
                    countUnchanged(EntityType.ORGANIZATION_SCOPE);
                }
            }

            for (RemoteScope scope : actual.organizationScopes().values()) {
                if (!wanted.containsKey(scope.name())) {
                    changes.add(Change.delete(EntityRef.of(EntityType.ORGANIZATION_SCOPE, scope.name()),
                        new OperationPayload.OrganizationScope(scope.name(), scope.description()),
                        List.of(), "Delete organization scope " + scope.name()));
                }
            }
        }

        // Roles

        void roles(RoleType type) {
            EntityType entityType = EntityType.forRole(type);
            Map<String, RoleState> remoteRoles = actual.roles(type);
            availableRoles.get(type).addAll(remoteRoles.keySet());

            if (options.skipRoles()) {
                return;
            }

            Map<String, RoleDefinition> wanted = wantedRoles(type);
            for (Map.Entry<String, RoleDefinition> entry : wanted.entrySet()) {
                String key = entry.getKey();
                RoleDefinition def = entry.getValue();
                EntityRef ref = EntityRef.of(entityType, key);
                String description = def.providerDescription();
                RoleState existing = remoteRoles.get(key);

                if (existing == null) {
                    changes.add(Change.create(ref,
                        new OperationPayload.Role(type, def.id(), description, false),
                        List.of(), "Create " + entityType.label() + " " + def.id()));
                    availableRoles.get(type).add(key);
                    createdRoles.get(type).add(key);
                } else if (!Objects.equals(existing.role().description(), description)) {
                    changes.add(Change.update(ref,
                        new OperationPayload.Role(type, existing.role().name(), description, existing.role().isDefault()),
                        List.of(), "Update " + entityType.label() + " " + def.id()));
                } else {
                    countUnchanged(entityType);
                }
            }

            for (Map.Entry<String, RoleState> entry : remoteRoles.entrySet()) {
                if (!wanted.containsKey(entry.getKey())) {
                    var role = entry.getValue().role();
                    changes.add(Change.delete(EntityRef.of(entityType, entry.getKey()),
                        new OperationPayload.Role(type, role.name(), role.description(), role.isDefault()),
                        List.of(), "Delete " + entityType.label() + " " + role.name()));
                }
            }
        }

        private Map<String, RoleDefinition> wantedRoles(RoleType type) {
            Map<String, RoleDefinition> wanted = new LinkedHashMap<>();
            for (RoleDefinition def : desired.roles(type)) {
                wanted.putIfAbsent(ActualState.roleKey(def.id()), def);
            }
            return wanted;
        }

        // Role-permission bindings

        void bindings(RoleType type) {
            if (options.skipPermissions()) {
                return;
            }

            EntityType roleEntity = EntityType.forRole(type);
            EntityType scopeEntity = type == RoleType.ORGANIZATION ? EntityType.ORGANIZATION_SCOPE : EntityType.SCOPE;
            Set<String> available = type == RoleType.ORGANIZATION ? availableOrgScopes : availableScopes;
            Set<String> created = type == RoleType.ORGANIZATION ? createdOrgScopes : createdScopes;

            for (Map.Entry<String, RoleDefinition> entry : wantedRoles(type).entrySet()) {
                String key = entry.getKey();
                RoleDefinition def = entry.getValue();
                EntityRef ref = EntityRef.of(EntityType.ROLE_PERMISSION, type.label() + "/" + key);
                EntityRef roleRef = EntityRef.of(roleEntity, key);

                if (!availableRoles.get(type).contains(key)) {
                    skipped.add(ReportItem.of(ref, "role " + def.id() + " does not exist and is not being created"));
                    continue;
                }

                List<String> target = new ArrayList<>();
                for (PermissionRef permission : def.permissions()) {
                    if (target.contains(permission.id())) {
                        continue;
                    }
                    if (type == RoleType.ORGANIZATION && !declaredScopes.contains(permission.id())) {
                        skipped.add(ReportItem.of(ref,
                            "permission " + permission.id() + " does not match any resource:action"));
                    } else if (available.contains(permission.id())) {
                        target.add(permission.id());
                    } else {
                        skipped.add(ReportItem.of(ref, "scope " + permission.id() + " is not available"));
                    }
                }

                RoleState existing = actual.roles(type).get(key);
                List<String> current = existing == null ? List.of() : managedBindings(type, existing);

                List<String> kept = current.stream().filter(target::contains).toList();
                List<String> toAssign = target.stream().filter(s -> !current.contains(s)).toList();
                List<String> toRemove = current.stream().filter(s -> !target.contains(s)).toList();

                List<EntityRef> dependsOn = new ArrayList<>();
                if (createdRoles.get(type).contains(key)) {
                    dependsOn.add(roleRef);
                }
                for (String scope : target) {
                    if (created.contains(scope)) {
                        dependsOn.add(EntityRef.of(scopeEntity, scope));
                    }
                }

                List<String> projected = new ArrayList<>(kept);
                projected.addAll(toAssign);

                if (!projected.equals(target)) {
                    changes.add(Change.update(ref,
                        new OperationPayload.Binding(type, key, target, current),
                        dependsOn, "Reorder permissions of " + roleEntity.label() + " " + def.id()));
                    continue;
                }
                if (toAssign.isEmpty() && toRemove.isEmpty()) {
                    countUnchanged(EntityType.ROLE_PERMISSION);
                    continue;
                }
                if (!toAssign.isEmpty()) {
                    changes.add(Change.create(ref,
                        new OperationPayload.Binding(type, key, toAssign, List.of()),
                        dependsOn, "Assign " + toAssign + " to " + roleEntity.label() + " " + def.id()));
                }
                if (!toRemove.isEmpty()) {
                    changes.add(Change.delete(ref,
                        new OperationPayload.Binding(type, key, List.of(), toRemove),
                        List.of(), "Remove " + toRemove + " from " + roleEntity.label() + " " + def.id()));
                }
            }
        }

        /**
         * Bound scope names the engine owns: not reserved, and for user roles
         * belonging to a non-protected resource.
         */
        private List<String> managedBindings(RoleType type, RoleState state) {
            List<String> names = new ArrayList<>();
            for (RemoteScope scope : state.scopes()) {
                if (protection.isReservedName(scope.name())) {
                    continue;
                }
                if (type == RoleType.USER && !managedResourceIds.contains(scope.resourceId())) {
                    continue;
                }
                if (!names.contains(scope.name())) {
                    names.add(scope.name());
                }
            }
            return names;
        }

        // Third-party applications

        void applications() {
            if (desired.thirdPartyApps().isEmpty()) {
                return;
            }

            Map<String, ApplicationDefinition> wanted = new LinkedHashMap<>();
            for (ApplicationDefinition def : desired.thirdPartyApps()) {
                wanted.putIfAbsent(def.name(), def);
            }

            for (ApplicationDefinition def : wanted.values()) {
                EntityRef ref = EntityRef.of(EntityType.APPLICATION, def.name());
                EntityRef accessRef = EntityRef.of(EntityType.ACCESS_CONTROL, def.name());
                List<String> scopes = def.effectiveScopes(settings.defaultApplicationScopes());
                List<EntityRef> roleRefs = new ArrayList<>();
                Map<String, Object> managedData = managedCustomData(def, accessRef, roleRefs);
                ApplicationState existing = actual.applications().get(def.name());

                if (existing == null) {
                    ApplicationSpec spec = new ApplicationSpec(def.name(), def.description(),
                        def.redirectUris(), def.postLogoutRedirectUris(), null);
                    changes.add(Change.create(ref,
                        new OperationPayload.Application(spec, def.displayName(), scopes, true,
                            def.displayName() != null, true),
                        List.of(), "Create application " + def.name()));
                    if (!managedData.isEmpty()) {
                        List<EntityRef> dependsOn = new ArrayList<>(roleRefs);
                        dependsOn.add(0, ref);
                        changes.add(Change.create(accessRef,
                            new OperationPayload.AccessControl(def.name(), managedData),
                            dependsOn, "Set access control of " + def.name()));
                    }
                    continue;
                }

                var remote = existing.application();
                boolean detailsChanged = !Objects.equals(nullToEmpty(remote.description()), nullToEmpty(def.description()))
                    || !sameSet(remote.redirectUris(), def.redirectUris())
                    || !sameSet(remote.postLogoutRedirectUris(), def.postLogoutRedirectUris());
                boolean brandingChanged = def.displayName() != null
                    && !Objects.equals(existing.displayName(), def.displayName());
                boolean scopesChanged = !sameSet(existing.consentScopes(), scopes);

                if (detailsChanged || brandingChanged || scopesChanged) {
                    ApplicationSpec spec = new ApplicationSpec(def.name(), def.description(),
                        def.redirectUris(), def.postLogoutRedirectUris(), null);
                    changes.add(Change.update(ref,
                        new OperationPayload.Application(spec, def.displayName(), scopes,
                            detailsChanged, brandingChanged, scopesChanged),
                        List.of(), "Update application " + def.name()));
                } else {
                    countUnchanged(EntityType.APPLICATION);
                }

                Map<String, Object> remoteManaged = new LinkedHashMap<>();
                copyIfPresent(remote.customData(), remoteManaged, ACCESS_CONTROL_KEY);
                copyIfPresent(remote.customData(), remoteManaged, LOGIN_URL_KEY);

                if (sameCustomData(remoteManaged, managedData)) {
                    if (!managedData.isEmpty()) {
                        countUnchanged(EntityType.ACCESS_CONTROL);
                    }
                    continue;
                }

                Map<String, Object> merged = new LinkedHashMap<>(remote.customData());
                merged.remove(ACCESS_CONTROL_KEY);
                merged.remove(LOGIN_URL_KEY);
                merged.putAll(managedData);

                if (managedData.isEmpty()) {
                    changes.add(Change.delete(accessRef,
                        new OperationPayload.AccessControl(def.name(), merged),
                        List.of(), "Clear access control of " + def.name()));
                } else {
                    changes.add(Change.update(accessRef,
                        new OperationPayload.AccessControl(def.name(), merged),
                        roleRefs, "Update access control of " + def.name()));
                }
            }

            for (ApplicationState state : actual.applications().values()) {
                var remote = state.application();
                if (!wanted.containsKey(remote.name())) {
                    changes.add(Change.delete(EntityRef.of(EntityType.APPLICATION, remote.name()),
                        new OperationPayload.Application(
                            new ApplicationSpec(remote.name(), remote.description(),
                                remote.redirectUris(), remote.postLogoutRedirectUris(), null),
                            state.displayName(), state.consentScopes(), false, false, false),
                        List.of(), "Delete application " + remote.name()));
                }
            }
        }

        /**
         * Custom data keys the engine owns for an application. Role ids that do not
         * exist remotely and are not being created are dropped and reported.
         */
        private Map<String, Object> managedCustomData(ApplicationDefinition def, EntityRef accessRef,
                                                      List<EntityRef> roleRefs) {
            Map<String, Object> data = new LinkedHashMap<>();
            if (!def.accessControl().isEmpty()) {
                List<String> orgRoles = resolveRoles(RoleType.ORGANIZATION,
                    def.accessControl().organizationRoles(), accessRef, roleRefs);
                List<String> userRoles = resolveRoles(RoleType.USER,
                    def.accessControl().userRoles(), accessRef, roleRefs);
                Map<String, Object> access = new LinkedHashMap<>();
                access.put("organization_roles", orgRoles);
                access.put("user_roles", userRoles);
                data.put(ACCESS_CONTROL_KEY, access);
            }
            if (def.loginUrl() != null && !def.loginUrl().isBlank()) {
                data.put(LOGIN_URL_KEY, def.loginUrl());
            }
            return data;
        }

        private List<String> resolveRoles(RoleType type, List<String> roleIds, EntityRef accessRef,
                                          List<EntityRef> roleRefs) {
            List<String> resolved = new ArrayList<>();
            for (String id : roleIds) {
                String key = ActualState.roleKey(id);
                if (!availableRoles.get(type).contains(key)) {
                    skipped.add(ReportItem.of(accessRef, type.label() + " role " + id + " is not available"));
                    continue;
                }
                if (!resolved.contains(id)) {
                    resolved.add(id);
                    roleRefs.add(EntityRef.of(EntityType.forRole(type), key));
                }
            }
            return resolved;
        }

        private void countUnchanged(EntityType type) {
            unchanged.merge(type, 1, Integer::sum);
        }
    }

    // Comparison helpers

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    static boolean sameSet(Collection<String> a, Collection<String> b) {
        return new HashSet<>(a).equals(new HashSet<>(b));
    }

    static boolean sameCustomData(Map<String, Object> remote, Map<String, Object> desired) {
        if (!Objects.equals(remote.get(LOGIN_URL_KEY), desired.get(LOGIN_URL_KEY))) {
            return false;
        }
        Object remoteAccess = remote.get(ACCESS_CONTROL_KEY);
        Object desiredAccess = desired.get(ACCESS_CONTROL_KEY);
        if (remoteAccess == null || desiredAccess == null) {
            return remoteAccess == null && desiredAccess == null;
        }
        if (!(remoteAccess instanceof Map<?, ?> r) || !(desiredAccess instanceof Map<?, ?> d)) {
            return false;
        }
        return sameSet(stringList(r.get("organization_roles")), stringList(d.get("organization_roles")))
            && sameSet(stringList(r.get("user_roles")), stringList(d.get("user_roles")));
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof Collection<?> items)) {
            return List.of();
        }
        return items.stream().map(String::valueOf).toList();
    }

    private static void copyIfPresent(Map<String, Object> from, Map<String, Object> to, String key) {
        if (from.get(key) != null) {
            to.put(key, from.get(key));
        }
    }

    private static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
