package tech.rolesync.engine.model;

/**
 * A role's reference to a scope, written as {@code resource:action}.
 *
 * <p>The same id names the organization scope that organization roles bind to.
 */
public record PermissionRef(
    String id,
    String name
) {

    public static PermissionRef of(String id) {
        return new PermissionRef(id, null);
    }

    /**
     * Name used for descriptions, falling back to the id.
     */
    public String displayName() {
        return name != null && !name.isBlank() ? name : id;
    }
}
