package tech.rolesync.engine.state;

import tech.rolesync.engine.provider.RemoteResource;
import tech.rolesync.engine.provider.RemoteScope;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A remote resource with the scopes it owns.
 */
public record ResourceState(
    RemoteResource resource,
    List<RemoteScope> scopes
) {

    public ResourceState {
        scopes = List.copyOf(scopes);
    }

    public Map<String, RemoteScope> scopesByName() {
        Map<String, RemoteScope> byName = new LinkedHashMap<>();
        for (RemoteScope scope : scopes) {
            byName.putIfAbsent(scope.name(), scope);
        }
        return byName;
    }
}
