package tech.rolesync.sdk.dto;

/**
 * A permission scope. {@code resourceId} is null for organization scopes.
 */
public record Scope(
    String id,
    String resourceId,
    String name,
    String description
) {}
