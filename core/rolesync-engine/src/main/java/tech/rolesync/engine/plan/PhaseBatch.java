package tech.rolesync.engine.plan;

import java.util.List;

/**
 * Operations of one phase. Operations inside a batch are independent of each other.
 */
public record PhaseBatch(
    Phase phase,
    boolean deletion,
    List<Operation> operations
) {

    public PhaseBatch {
        operations = List.copyOf(operations);
    }

    public String name() {
        return deletion ? phase + " (delete)" : phase.toString();
    }
}
