package tech.rolesync.engine.provider;

/**
 * A resource scope or an organization scope. {@code resourceId} is null for the latter.
 */
public record RemoteScope(
    String id,
    String name,
    String description,
    String resourceId
) {}
