package tech.rolesync.engine.state;

import tech.rolesync.engine.provider.RemoteApplication;

import java.util.List;

/**
 * A remote third-party application with its branding and consent scopes.
 *
 * @param displayName null when no sign-in experience is configured
 */
public record ApplicationState(
    RemoteApplication application,
    String displayName,
    List<String> consentScopes
) {

    public ApplicationState {
        consentScopes = consentScopes == null ? List.of() : List.copyOf(consentScopes);
    }
}
