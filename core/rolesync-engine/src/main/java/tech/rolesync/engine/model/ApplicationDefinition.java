package tech.rolesync.engine.model;

import java.util.List;

/**
 * A desired third-party application registration. {@code name} is the natural key.
 */
public record ApplicationDefinition(
    String name,
    String displayName,
    String description,
    String loginUrl,
    List<String> scopes,
    List<String> redirectUris,
    List<String> postLogoutRedirectUris,
    AccessControl accessControl
) {

    public ApplicationDefinition {
        scopes = scopes == null ? List.of() : List.copyOf(scopes);
        redirectUris = redirectUris == null ? List.of() : List.copyOf(redirectUris);
        postLogoutRedirectUris = postLogoutRedirectUris == null ? List.of() : List.copyOf(postLogoutRedirectUris);
        accessControl = accessControl == null ? AccessControl.none() : accessControl;
    }

    /**
     * Consent scopes to request: the declared ones, or the given defaults when none are declared.
     */
    public List<String> effectiveScopes(List<String> defaults) {
        return scopes.isEmpty() ? List.copyOf(defaults) : scopes;
    }
}
