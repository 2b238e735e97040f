package tech.rolesync.engine.errors;

/**
 * Reading actual state from the provider failed. No mutation has happened.
 */
public class StateLoadException extends EngineException {

    private final String category;

    public StateLoadException(String category, String message, Throwable cause) {
        super("Failed to load " + category + ": " + message, cause);
        this.category = category;
    }

    public String getCategory() {
        return category;
    }
}
