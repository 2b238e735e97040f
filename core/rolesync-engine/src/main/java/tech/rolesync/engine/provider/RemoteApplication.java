package tech.rolesync.engine.provider;

import java.util.List;
import java.util.Map;

/**
 * A third-party application as registered on the provider.
 */
public record RemoteApplication(
    String id,
    String name,
    String description,
    List<String> redirectUris,
    List<String> postLogoutRedirectUris,
    Map<String, Object> customData
) {

    public RemoteApplication {
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
        postLogoutRedirectUris = postLogoutRedirectUris == null ? List.of() : List.copyOf(postLogoutRedirectUris);
        customData = customData == null ? Map.of() : customData;
    }
}
