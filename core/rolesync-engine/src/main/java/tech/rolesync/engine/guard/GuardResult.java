package tech.rolesync.engine.guard;

import tech.rolesync.engine.diff.Change;
import tech.rolesync.engine.report.ReportItem;

import java.util.List;

/**
 * Changes split by the safety guard.
 *
 * @param allowed changes that may be ordered and executed
 * @param protectedItems withheld because the target belongs to the provider
 * @param wouldRemove destructive changes withheld because cleanup is off
 */
public record GuardResult(
    List<Change> allowed,
    List<ReportItem> protectedItems,
    List<ReportItem> wouldRemove
) {

    public GuardResult {
        allowed = List.copyOf(allowed);
        protectedItems = List.copyOf(protectedItems);
        wouldRemove = List.copyOf(wouldRemove);
    }
}
