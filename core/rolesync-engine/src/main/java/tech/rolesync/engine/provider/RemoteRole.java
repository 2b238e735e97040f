package tech.rolesync.engine.provider;

public record RemoteRole(
    String id,
    String name,
    String description,
    boolean isDefault
) {}
