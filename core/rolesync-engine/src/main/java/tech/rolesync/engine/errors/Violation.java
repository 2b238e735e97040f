package tech.rolesync.engine.errors;

/**
 * A single problem found in the desired state.
 *
 * @param path location in the document, e.g. {@code user_roles[admin].permissions[2]}
 */
public record Violation(
    String path,
    String message
) {

    @Override
    public String toString() {
        return path + ": " + message;
    }
}
