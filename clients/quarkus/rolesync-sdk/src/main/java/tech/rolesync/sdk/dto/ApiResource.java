package tech.rolesync.sdk.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An API resource registered with the identity provider.
 */
public record ApiResource(
    String id,
    String name,
    String indicator,
    @JsonProperty("isDefault") boolean isDefault,
    Integer accessTokenTtl
) {}
