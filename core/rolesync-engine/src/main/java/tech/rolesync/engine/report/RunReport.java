package tech.rolesync.engine.report;

import com.fasterxml.jackson.annotation.JsonProperty;
import tech.rolesync.engine.RunState;
import tech.rolesync.engine.exec.OperationResult;
import tech.rolesync.engine.plan.EntityType;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one reconciliation run.
 *
 * @param state REPORTED for a completed run, ABORTED when cancelled or stopped by a fatal phase
 * @param abortReason null unless a phase failed fatally or the run was cancelled
 * @param success true iff no operation failed or was blocked and the run was neither cancelled nor aborted
 */
public record RunReport(
    String runId,
    Instant startedAt,
    Instant finishedAt,
    boolean dryRun,
    boolean cleanup,
    RunState state,
    boolean cancelled,
    String abortReason,
    Map<EntityType, EntityCounts> counts,
    List<OperationResult> operations,
    List<ReportItem> protectedItems,
    List<ReportItem> wouldRemove,
    List<ReportItem> skipped,
    boolean success
) {

    public RunReport {
        counts = Map.copyOf(counts);
        operations = List.copyOf(operations);
        protectedItems = List.copyOf(protectedItems);
        wouldRemove = List.copyOf(wouldRemove);
        skipped = List.copyOf(skipped);
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    @JsonProperty("durationMs")
    public long durationMillis() {
        return duration().toMillis();
    }

    public EntityCounts countsFor(EntityType type) {
        return counts.getOrDefault(type, EntityCounts.zero());
    }

    public List<OperationResult> failures() {
        return operations.stream().filter(OperationResult::isFailure).toList();
    }
}
