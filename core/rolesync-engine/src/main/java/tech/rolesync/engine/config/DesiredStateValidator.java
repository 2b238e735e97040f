package tech.rolesync.engine.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import tech.rolesync.engine.errors.ValidationException;
import tech.rolesync.engine.errors.Violation;
import tech.rolesync.engine.guard.ProtectionPolicy;
import tech.rolesync.engine.model.ApplicationDefinition;
import tech.rolesync.engine.model.DesiredState;
import tech.rolesync.engine.model.PermissionRef;
import tech.rolesync.engine.model.ResourceDefinition;
import tech.rolesync.engine.model.RoleDefinition;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.state.ActualState;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Checks a desired state for problems that must stop a run before any network access.
 *
 * <p>Checks:
 * <ul>
 *   <li>names and ids are present and unique per entity type (role ids case-insensitively)</li>
 *   <li>every resource declares at least one action, none blank or repeated</li>
 *   <li>nothing uses a name reserved by the provider</li>
 *   <li>every permission names a scope of a desired resource</li>
 *   <li>application access control names desired roles of the matching type</li>
 * </ul>
 */
@ApplicationScoped
public class DesiredStateValidator {

    private final ProtectionPolicy protection;

    @Inject
    public DesiredStateValidator(EngineConfig config) {
        this(ProtectionPolicy.from(config.protection()));
    }

    public DesiredStateValidator(ProtectionPolicy protection) {
        this.protection = protection;
    }

    /**
     * @throws ValidationException listing every violation found
     */
    public void check(DesiredState state) {
        List<Violation> violations = validate(state);
        if (!violations.isEmpty()) {
            throw new ValidationException(violations);
        }
    }

    public List<Violation> validate(DesiredState state) {
        List<Violation> violations = new ArrayList<>();
        Set<String> scopeNames = resources(state.resources(), violations);
        roles(state.organizationRoles(), "organization_roles", scopeNames, violations);
        roles(state.userRoles(), "user_roles", scopeNames, violations);
        applications(state, violations);
        return violations;
    }

    /**
     * Drop entries that cannot be reconciled at all: missing names, ids or actions.
     * Used when a run is forced past validation.
     */
    public DesiredState prune(DesiredState state) {
        List<ResourceDefinition> resources = state.resources().stream()
            .filter(r -> !isBlank(r.name()))
            .map(r -> new ResourceDefinition(r.name(),
                r.actions().stream().filter(a -> !isBlank(a)).toList(), r.accessTokenTtl()))
            .toList();
        return new DesiredState(state.metadata(), resources,
            pruneRoles(state.organizationRoles()), pruneRoles(state.userRoles()),
            state.thirdPartyApps().stream().filter(a -> !isBlank(a.name())).toList());
    }

    private static List<RoleDefinition> pruneRoles(List<RoleDefinition> roles) {
        return roles.stream()
            .filter(r -> !isBlank(r.id()))
            .map(r -> new RoleDefinition(r.id(), r.name(), r.priority(),
                r.permissions().stream().filter(p -> !isBlank(p.id())).toList()))
            .toList();
    }

    private Set<String> resources(List<ResourceDefinition> resources, List<Violation> violations) {
        Set<String> names = new HashSet<>();
        Set<String> scopeNames = new HashSet<>();
        for (int i = 0; i < resources.size(); i++) {
            ResourceDefinition resource = resources.get(i);
            if (isBlank(resource.name())) {
                violations.add(new Violation("resources[" + i + "].name", "resource name is required"));
                continue;
            }
            String path = "resources[" + resource.name() + "]";
            if (!names.add(resource.name())) {
                violations.add(new Violation(path, "duplicate resource name"));
            }
            if (protection.isReservedName(resource.name())) {
                violations.add(new Violation(path, "resource name is reserved by the provider"));
            }
            if (resource.accessTokenTtl() != null && resource.accessTokenTtl() <= 0) {
                violations.add(new Violation(path + ".access_token_ttl", "must be positive"));
            }
            if (resource.actions().isEmpty()) {
                violations.add(new Violation(path + ".actions", "at least one action is required"));
            }
            Set<String> actions = new HashSet<>();
            for (String action : resource.actions()) {
                if (isBlank(action)) {
                    violations.add(new Violation(path + ".actions", "empty action"));
                } else if (!actions.add(action)) {
                    violations.add(new Violation(path + ".actions", "duplicate action " + action));
                } else {
                    scopeNames.add(resource.scopeName(action));
                }
            }
        }
        return scopeNames;
    }

    private void roles(List<RoleDefinition> roles, String section, Set<String> scopeNames,
                       List<Violation> violations) {
        Set<String> keys = new HashSet<>();
        for (int i = 0; i < roles.size(); i++) {
            RoleDefinition role = roles.get(i);
            if (isBlank(role.id())) {
                violations.add(new Violation(section + "[" + i + "].id", "role id is required"));
                continue;
            }
            String path = section + "[" + role.id() + "]";
            if (!keys.add(ActualState.roleKey(role.id()))) {
                violations.add(new Violation(path, "duplicate role id"));
            }
            if (isBlank(role.name())) {
                violations.add(new Violation(path + ".name", "role name is required"));
            }
            if (role.priority() < 0) {
                violations.add(new Violation(path + ".priority", "must be non-negative"));
            }
            if (protection.isReservedName(role.id())) {
                violations.add(new Violation(path, "role id is reserved by the provider"));
            }

            Set<String> seen = new HashSet<>();
            for (int p = 0; p < role.permissions().size(); p++) {
                PermissionRef permission = role.permissions().get(p);
                String permissionPath = path + ".permissions[" + p + "]";
                if (isBlank(permission.id())) {
                    violations.add(new Violation(permissionPath, "permission id is required"));
                } else if (!seen.add(permission.id())) {
                    violations.add(new Violation(permissionPath, "duplicate permission " + permission.id()));
                } else if (!scopeNames.contains(permission.id())) {
                    violations.add(new Violation(permissionPath,
                        "permission " + permission.id() + " does not match any resource:action"));
                }
            }
        }
    }

    private void applications(DesiredState state, List<Violation> violations) {
        Set<String> orgRoles = roleKeys(state, RoleType.ORGANIZATION);
        Set<String> userRoles = roleKeys(state, RoleType.USER);
        Set<String> names = new HashSet<>();

        for (int i = 0; i < state.thirdPartyApps().size(); i++) {
            ApplicationDefinition app = state.thirdPartyApps().get(i);
            if (isBlank(app.name())) {
                violations.add(new Violation("third_party_apps[" + i + "].name", "application name is required"));
                continue;
            }
            String path = "third_party_apps[" + app.name() + "]";
            if (!names.add(app.name())) {
                violations.add(new Violation(path, "duplicate application name"));
            }
            if (protection.isReservedName(app.name())) {
                violations.add(new Violation(path, "application name is reserved by the provider"));
            }
            for (String role : app.accessControl().organizationRoles()) {
                if (isBlank(role) || !orgRoles.contains(ActualState.roleKey(role))) {
                    violations.add(new Violation(path + ".access_control.organization_roles",
                        "unknown organization role " + role));
                }
            }
            for (String role : app.accessControl().userRoles()) {
                if (isBlank(role) || !userRoles.contains(ActualState.roleKey(role))) {
                    violations.add(new Violation(path + ".access_control.user_roles",
                        "unknown user role " + role));
                }
            }
        }
    }

    private static Set<String> roleKeys(DesiredState state, RoleType type) {
        Set<String> keys = new HashSet<>();
        for (RoleDefinition role : state.roles(type)) {
            if (!isBlank(role.id())) {
                keys.add(ActualState.roleKey(role.id()));
            }
        }
        return keys;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
