package tech.rolesync.engine.plan;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import tech.rolesync.engine.diff.Change;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Sequences allowed changes into phase batches.
 *
 * <p>Creates and updates run phase by phase in {@link Phase} order. Deletes
 * follow, phase by phase in reverse, so dependents go before what they depend on.
 * Inside a phase the differ's order is kept, grouped by entity type.
 */
@ApplicationScoped
public class DependencyOrderer {

    private static final Logger LOG = Logger.getLogger(DependencyOrderer.class);

    public ExecutionPlan order(List<Change> changes) {
        List<PhaseBatch> batches = new ArrayList<>();
        int[] sequence = {0};

        for (Phase phase : Phase.values()) {
            addBatch(batches, phase, false, changes, sequence);
        }
        Phase[] phases = Phase.values();
        for (int i = phases.length - 1; i >= 0; i--) {
            addBatch(batches, phases[i], true, changes, sequence);
        }

        ExecutionPlan plan = new ExecutionPlan(batches);
        checkDependencies(plan);
        LOG.debugf("Ordered %d operations into %d batches", plan.size(), batches.size());
        return plan;
    }

    private void addBatch(List<PhaseBatch> batches, Phase phase, boolean deletion,
                          List<Change> changes, int[] sequence) {
        List<Change> selected = changes.stream()
            .filter(c -> c.entityType().phase() == phase)
            .filter(c -> (c.kind() == OperationKind.DELETE) == deletion)
            .sorted(Comparator.comparingInt(c -> c.entityType().ordinal()))
            .toList();
        if (selected.isEmpty()) {
            return;
        }

        List<Operation> operations = new ArrayList<>(selected.size());
        for (Change change : selected) {
            operations.add(new Operation(++sequence[0], change.kind(), change.ref(),
                change.payload(), change.dependsOn(), change.summary()));
        }
        batches.add(new PhaseBatch(phase, deletion, operations));
    }

    /**
     * Every dependency that is itself scheduled must sit in an earlier batch.
     */
    private void checkDependencies(ExecutionPlan plan) {
        Map<EntityRef, Integer> batchOf = new HashMap<>();
        List<PhaseBatch> batches = plan.batches();
        for (int i = 0; i < batches.size(); i++) {
            for (Operation op : batches.get(i).operations()) {
                batchOf.putIfAbsent(op.ref(), i);
            }
        }
        for (int i = 0; i < batches.size(); i++) {
            for (Operation op : batches.get(i).operations()) {
                for (EntityRef dependency : op.dependsOn()) {
                    Integer at = batchOf.get(dependency);
                    if (at != null && at >= i) {
                        throw new IllegalStateException("Operation " + op.summary()
                            + " depends on " + dependency + " which is not scheduled earlier");
                    }
                }
            }
        }
    }
}
