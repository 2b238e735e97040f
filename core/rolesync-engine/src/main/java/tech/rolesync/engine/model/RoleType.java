package tech.rolesync.engine.model;

/**
 * Whether a role applies inside an organization or to the user globally.
 */
public enum RoleType {
    ORGANIZATION("org"),
    USER("user");

    private final String label;

    RoleType(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }
}
