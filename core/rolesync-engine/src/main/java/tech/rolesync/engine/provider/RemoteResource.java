package tech.rolesync.engine.provider;

public record RemoteResource(
    String id,
    String name,
    String indicator,
    boolean isDefault,
    Integer accessTokenTtl
) {}
