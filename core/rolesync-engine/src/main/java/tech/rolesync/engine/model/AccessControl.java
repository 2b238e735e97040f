package tech.rolesync.engine.model;

import java.util.List;

/**
 * Roles allowed to use a third-party application.
 */
public record AccessControl(
    List<String> organizationRoles,
    List<String> userRoles
) {

    public AccessControl {
        organizationRoles = organizationRoles == null ? List.of() : List.copyOf(organizationRoles);
        userRoles = userRoles == null ? List.of() : List.copyOf(userRoles);
    }

    public static AccessControl none() {
        return new AccessControl(List.of(), List.of());
    }

    public boolean isEmpty() {
        return organizationRoles.isEmpty() && userRoles.isEmpty();
    }
}
