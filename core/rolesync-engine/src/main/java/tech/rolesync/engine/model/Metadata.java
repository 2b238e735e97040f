package tech.rolesync.engine.model;

/**
 * Descriptive header of a desired-state document.
 */
public record Metadata(
    String name,
    String version,
    String description
) {

    public static Metadata empty() {
        return new Metadata(null, null, null);
    }
}
