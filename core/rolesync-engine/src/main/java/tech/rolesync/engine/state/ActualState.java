package tech.rolesync.engine.state;

import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.provider.RemoteScope;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Snapshot of the provider's RBAC entities taken at the start of a run.
 *
 * <p>Keys: resources and applications by name, organization scopes by name,
 * roles by lower-cased name.
 */
public record ActualState(
    Map<String, ResourceState> resources,
    Map<String, RemoteScope> organizationScopes,
    Map<String, RoleState> organizationRoles,
    Map<String, RoleState> userRoles,
    Map<String, ApplicationState> applications
) {

    public ActualState {
        resources = freeze(resources);
        organizationScopes = freeze(organizationScopes);
        organizationRoles = freeze(organizationRoles);
        userRoles = freeze(userRoles);
        applications = freeze(applications);
    }

    public static ActualState empty() {
        return new ActualState(Map.of(), Map.of(), Map.of(), Map.of(), Map.of());
    }

    public Map<String, RoleState> roles(RoleType type) {
        return type == RoleType.ORGANIZATION ? organizationRoles : userRoles;
    }

    public static String roleKey(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    private static <V> Map<String, V> freeze(Map<String, V> map) {
        return Collections.unmodifiableMap(new LinkedHashMap<>(map));
    }
}
