package tech.rolesync.engine.plan;

import java.util.List;

/**
 * Ordered phase batches: forward phases first, then deletion phases in reverse order.
 */
public record ExecutionPlan(
    List<PhaseBatch> batches
) {

    public ExecutionPlan {
        batches = List.copyOf(batches);
    }

    public List<Operation> operations() {
        return batches.stream().flatMap(b -> b.operations().stream()).toList();
    }

    public int size() {
        return batches.stream().mapToInt(b -> b.operations().size()).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
