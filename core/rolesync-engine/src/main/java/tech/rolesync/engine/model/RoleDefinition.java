package tech.rolesync.engine.model;

import java.util.Arrays;
import java.util.List;

/**
 * A desired organization or user role. {@code id} is the natural key and becomes
 * the role's name on the provider.
 */
public record RoleDefinition(
    String id,
    String name,
    int priority,
    List<PermissionRef> permissions
) {

    public RoleDefinition {
        permissions = permissions == null ? List.of() : List.copyOf(permissions);
    }

    public static RoleDefinition of(String id, String name, int priority, String... permissionIds) {
        return new RoleDefinition(id, name, priority,
            Arrays.stream(permissionIds).map(PermissionRef::of).toList());
    }

    /**
     * Description stored on the provider. Encodes display name and priority so
     * that either change is detected as drift.
     */
    public String providerDescription() {
        String display = name != null && !name.isBlank() ? name : id;
        return display + " (priority " + priority + ")";
    }
}
