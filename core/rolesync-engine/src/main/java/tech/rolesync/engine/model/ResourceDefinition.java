package tech.rolesync.engine.model;

import java.util.List;

/**
 * A desired API resource and the actions it exposes as scopes.
 *
 * @param accessTokenTtl token lifetime in seconds; null means the engine default
 */
public record ResourceDefinition(
    String name,
    List<String> actions,
    Integer accessTokenTtl
) {

    public ResourceDefinition {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }

    public static ResourceDefinition of(String name, String... actions) {
        return new ResourceDefinition(name, List.of(actions), null);
    }

    /**
     * Scope name for one of this resource's actions.
     */
    public String scopeName(String action) {
        return name + ":" + action;
    }
}
