package tech.rolesync.engine.plan;

import java.util.List;

/**
 * One scheduled create, update or delete.
 *
 * @param sequence position in the execution plan, starting at 1
 * @param dependsOn entities whose operations must not have failed for this one to run
 */
public record Operation(
    int sequence,
    OperationKind kind,
    EntityRef ref,
    OperationPayload payload,
    List<EntityRef> dependsOn,
    String summary
) {

    public Operation {
        dependsOn = List.copyOf(dependsOn);
    }

    public EntityType entityType() {
        return ref.type();
    }
}
