package tech.rolesync.sdk.dto;

/**
 * An organization role template.
 */
public record OrganizationRole(
    String id,
    String name,
    String description
) {}
