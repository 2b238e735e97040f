package tech.rolesync.engine.diff;

import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.OperationKind;
import tech.rolesync.engine.report.ReportItem;

import java.util.List;
import java.util.Map;

/**
 * Output of the differ.
 *
 * @param unchanged per-type count of entities that matched exactly
 * @param skipped entities that could not be reconciled this run
 */
public record DiffResult(
    List<Change> changes,
    Map<EntityType, Integer> unchanged,
    List<ReportItem> skipped
) {

    public DiffResult {
        changes = List.copyOf(changes);
        unchanged = Map.copyOf(unchanged);
        skipped = List.copyOf(skipped);
    }

    public List<Change> changesOf(EntityType type) {
        return changes.stream().filter(c -> c.entityType() == type).toList();
    }

    public List<Change> changesOf(OperationKind kind) {
        return changes.stream().filter(c -> c.kind() == kind).toList();
    }

    public int unchangedCount(EntityType type) {
        return unchanged.getOrDefault(type, 0);
    }

    /**
     * True when desired and actual state already agree.
     */
    public boolean isEmpty() {
        return changes.isEmpty();
    }
}
