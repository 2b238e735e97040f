package tech.rolesync.engine;

/**
 * Lifecycle of a reconciliation run. {@link #REPORTED} and {@link #ABORTED} are terminal.
 */
public enum RunState {
    VALIDATED,
    STATE_LOADED,
    DIFFED,
    GUARDED,
    ORDERED,
    APPLYING,
    REPORTED,
    ABORTED;

    public boolean isTerminal() {
        return this == REPORTED || this == ABORTED;
    }
}
