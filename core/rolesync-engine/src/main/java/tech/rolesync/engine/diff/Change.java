package tech.rolesync.engine.diff;

import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.OperationKind;
import tech.rolesync.engine.plan.OperationPayload;

import java.util.List;

/**
 * A difference between desired and actual state, before guarding and ordering.
 */
public record Change(
    OperationKind kind,
    EntityRef ref,
    OperationPayload payload,
    List<EntityRef> dependsOn,
    String summary
) {

    public Change {
        dependsOn = List.copyOf(dependsOn);
    }

    public static Change create(EntityRef ref, OperationPayload payload, List<EntityRef> dependsOn, String summary) {
        return new Change(OperationKind.CREATE, ref, payload, dependsOn, summary);
    }

    public static Change update(EntityRef ref, OperationPayload payload, List<EntityRef> dependsOn, String summary) {
        return new Change(OperationKind.UPDATE, ref, payload, dependsOn, summary);
    }

    public static Change delete(EntityRef ref, OperationPayload payload, List<EntityRef> dependsOn, String summary) {
        return new Change(OperationKind.DELETE, ref, payload, dependsOn, summary);
    }

    public EntityType entityType() {
        return ref.type();
    }
}
