package tech.rolesync.engine.exec;

import java.util.List;

/**
 * What the executor did with a plan.
 *
 * @param results results of operations that were started, in plan order
 * @param abortReason set when a phase failed fatally
 */
public record ExecutionOutcome(
    List<OperationResult> results,
    boolean cancelled,
    boolean aborted,
    String abortReason
) {

    public ExecutionOutcome {
        results = List.copyOf(results);
    }
}
