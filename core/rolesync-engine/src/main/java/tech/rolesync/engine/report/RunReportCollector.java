package tech.rolesync.engine.report;

import tech.rolesync.engine.RunState;
import tech.rolesync.engine.exec.OperationResult;
import tech.rolesync.engine.exec.OperationStatus;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.ExecutionPlan;
import tech.rolesync.engine.plan.Operation;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;

/**
 * Accumulates report data while a run progresses. Executor workers append results
 * concurrently; each result has a single writer.
 */
public class RunReportCollector {

    private final Queue<OperationResult> results = new ConcurrentLinkedQueue<>();
    private final Queue<ReportItem> protectedItems = new ConcurrentLinkedQueue<>();
    private final Queue<ReportItem> wouldRemove = new ConcurrentLinkedQueue<>();
    private final Queue<ReportItem> skipped = new ConcurrentLinkedQueue<>();
    private final Map<EntityType, Integer> unchanged = new ConcurrentHashMap<>();
    private final Queue<Operation> planned = new ConcurrentLinkedQueue<>();

    public void recordPlan(ExecutionPlan plan) {
        planned.addAll(plan.operations());
    }

    public void record(OperationResult result) {
        results.add(result);
    }

    public void recordUnchanged(Map<EntityType, Integer> counts) {
        counts.forEach((type, n) -> unchanged.merge(type, n, Integer::sum));
    }

    public void addProtected(Collection<ReportItem> items) {
        protectedItems.addAll(items);
    }

    public void addWouldRemove(Collection<ReportItem> items) {
        wouldRemove.addAll(items);
    }

    public void addSkipped(Collection<ReportItem> items) {
        skipped.addAll(items);
    }

    public void addSkipped(ReportItem item) {
        skipped.add(item);
    }

    /**
     * Results recorded so far, in plan order.
     */
    public List<OperationResult> results() {
        List<OperationResult> sorted = new ArrayList<>(results);
        sorted.sort(Comparator.comparingInt(OperationResult::sequence));
        return sorted;
    }

    public RunReport build(String runId, Instant startedAt, Instant finishedAt, boolean dryRun,
                           boolean cleanup, RunState state, boolean cancelled, String abortReason) {
        List<OperationResult> operations = results();
        boolean anyFailure = operations.stream().anyMatch(OperationResult::isFailure);
        boolean success = !anyFailure && !cancelled && state != RunState.ABORTED;

        return new RunReport(runId, startedAt, finishedAt, dryRun, cleanup, state, cancelled, abortReason,
            counts(operations, cancelled || state == RunState.ABORTED), operations,
            List.copyOf(protectedItems), List.copyOf(wouldRemove), List.copyOf(skipped), success);
    }

    /**
     * Tallies per entity type. An interrupted run counts only the planned operations
     * that produced a result; the rest never reached the provider.
     */
    private Map<EntityType, EntityCounts> counts(List<OperationResult> operations, boolean interrupted) {
        Set<Integer> reached = new HashSet<>();
        operations.forEach(result -> reached.add(result.sequence()));

        Map<EntityType, int[]> tallies = new EnumMap<>(EntityType.class);
        for (EntityType type : EntityType.values()) {
            tallies.put(type, new int[9]);
        }

        for (Operation op : planned) {
            if (interrupted && !reached.contains(op.sequence())) {
                continue;
            }
            int[] t = tallies.get(op.entityType());
            switch (op.kind()) {
                case CREATE -> t[0]++;
                case UPDATE -> t[1]++;
                case DELETE -> t[2]++;
            }
        }
        unchanged.forEach((type, n) -> tallies.get(type)[3] += n);
        protectedItems.forEach(item -> tallies.get(item.entityType())[4]++);
        wouldRemove.forEach(item -> tallies.get(item.entityType())[5]++);
        skipped.forEach(item -> tallies.get(item.entityType())[6]++);
        for (OperationResult result : operations) {
            if (result.status() == OperationStatus.FAILED) {
                tallies.get(result.entityType())[7]++;
            } else if (result.status() == OperationStatus.BLOCKED) {
                tallies.get(result.entityType())[8]++;
            }
        }

        Map<EntityType, EntityCounts> counts = new EnumMap<>(EntityType.class);
        tallies.forEach((type, t) -> counts.put(type,
            new EntityCounts(t[0], t[1], t[2], t[3], t[4], t[5], t[6], t[7], t[8])));
        return counts;
    }
}
