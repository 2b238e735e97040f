package tech.rolesync.engine.model;

import java.util.List;

/**
 * The validated target RBAC hierarchy.
 */
public record DesiredState(
    Metadata metadata,
    List<ResourceDefinition> resources,
    List<RoleDefinition> organizationRoles,
    List<RoleDefinition> userRoles,
    List<ApplicationDefinition> thirdPartyApps
) {

    public DesiredState {
        metadata = metadata == null ? Metadata.empty() : metadata;
        resources = resources == null ? List.of() : List.copyOf(resources);
        organizationRoles = organizationRoles == null ? List.of() : List.copyOf(organizationRoles);
        userRoles = userRoles == null ? List.of() : List.copyOf(userRoles);
        thirdPartyApps = thirdPartyApps == null ? List.of() : List.copyOf(thirdPartyApps);
    }

    public List<RoleDefinition> roles(RoleType type) {
        return type == RoleType.ORGANIZATION ? organizationRoles : userRoles;
    }
}
