package tech.rolesync.engine.state;

import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.provider.RemoteRole;
import tech.rolesync.engine.provider.RemoteScope;

import java.util.List;

/**
 * A remote role with its scope bindings, in the order the provider returned them.
 */
public record RoleState(
    RoleType type,
    RemoteRole role,
    List<RemoteScope> scopes
) {

    public RoleState {
        scopes = List.copyOf(scopes);
    }
}
