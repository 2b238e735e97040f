package tech.rolesync.engine.plan;

/**
 * Forward phase order. Deletions run through the same phases in reverse.
 */
public enum Phase {
    RESOURCES,
    SCOPES,
    ORGANIZATION_ROLES,
    USER_ROLES,
    ROLE_PERMISSIONS,
    APPLICATIONS,
    ACCESS_CONTROL
}
