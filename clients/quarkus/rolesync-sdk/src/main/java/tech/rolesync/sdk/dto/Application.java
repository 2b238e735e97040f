package tech.rolesync.sdk.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * An application registration.
 */
public record Application(
    String id,
    String name,
    String description,
    String type,
    @JsonProperty("isThirdParty") boolean isThirdParty,
    Map<String, Object> customData,
    OidcClientMetadata oidcClientMetadata
) {

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record OidcClientMetadata(
        List<String> redirectUris,
        List<String> postLogoutRedirectUris
    ) {}
}
