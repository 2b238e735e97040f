package tech.rolesync.engine.provider;

import java.util.List;
import java.util.Map;

/**
 * Fields written when creating or updating a third-party application.
 *
 * @param customData written on create only; null leaves it unchanged on update
 */
public record ApplicationSpec(
    String name,
    String description,
    List<String> redirectUris,
    List<String> postLogoutRedirectUris,
    Map<String, Object> customData
) {}
