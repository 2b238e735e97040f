package tech.rolesync.engine.report;

/**
 * Per-entity-type tallies of a run.
 *
 * <p>created, updated and deleted are taken from the allowed plan, so a dry run and
 * the matching live run report the same numbers. A cancelled or aborted run counts
 * only the operations that produced a result.
 */
public record EntityCounts(
    int created,
    int updated,
    int deleted,
    int unchanged,
    int protectedCount,
    int wouldRemove,
    int skipped,
    int failed,
    int blocked
) {

    public static EntityCounts zero() {
        return new EntityCounts(0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    public int changes() {
        return created + updated + deleted;
    }
}
