package tech.rolesync.engine.report;

import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;

/**
 * An entity listed in the report without an operation: protected, would-remove or skipped.
 */
public record ReportItem(
    EntityType entityType,
    String key,
    String reason
) {

    public static ReportItem of(EntityRef ref, String reason) {
        return new ReportItem(ref.type(), ref.key(), reason);
    }
}
