package tech.rolesync.engine.plan;

import tech.rolesync.engine.model.RoleType;

/**
 * Entity types the engine reconciles, each applied in one {@link Phase}.
 */
public enum EntityType {
    RESOURCE(Phase.RESOURCES, "resource", true),
    SCOPE(Phase.SCOPES, "scope", true),
    ORGANIZATION_SCOPE(Phase.SCOPES, "organization scope", true),
    ORGANIZATION_ROLE(Phase.ORGANIZATION_ROLES, "organization role", true),
    USER_ROLE(Phase.USER_ROLES, "user role", true),
    ROLE_PERMISSION(Phase.ROLE_PERMISSIONS, "role permissions", false),
    APPLICATION(Phase.APPLICATIONS, "application", true),
    ACCESS_CONTROL(Phase.ACCESS_CONTROL, "access control", false);

    private final Phase phase;
    private final String label;
    private final boolean cleanupGated;

    EntityType(Phase phase, String label, boolean cleanupGated) {
        this.phase = phase;
        this.label = label;
        this.cleanupGated = cleanupGated;
    }

    public Phase phase() {
        return phase;
    }

    public String label() {
        return label;
    }

    /**
     * True if deleting this type removes an entity and therefore needs cleanup enabled.
     * Binding removals are part of updating their owner and are not gated.
     */
    public boolean isCleanupGated() {
        return cleanupGated;
    }

    public static EntityType forRole(RoleType type) {
        return type == RoleType.ORGANIZATION ? ORGANIZATION_ROLE : USER_ROLE;
    }
}
