package tech.rolesync.engine.exec;

/**
 * Outcome of one scheduled operation.
 */
public enum OperationStatus {
    SUCCEEDED,
    FAILED,
    /** Dry-run: computed, never sent. */
    SIMULATED,
    /** Not attempted because a prerequisite failed or was blocked. */
    BLOCKED
}
