package tech.rolesync.engine.errors;

/**
 * Base exception for errors that abort a reconciliation run before or while
 * loading state. Per-operation failures are never thrown; they are recorded in the run report.
 */
public class EngineException extends RuntimeException {

    public EngineException(String message) {
        super(message);
    }

    public EngineException(String message, Throwable cause) {
        super(message, cause);
    }
}
