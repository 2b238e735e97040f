package tech.rolesync.engine.exec;

import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.Operation;
import tech.rolesync.engine.plan.OperationKind;
import tech.rolesync.engine.provider.ProviderErrorKind;

/**
 * Result of one operation, as it appears in the run report.
 *
 * @param errorKind null unless FAILED with a provider error
 * @param attempts calls made, 0 for simulated or blocked operations
 * @param remoteId id of the entity the operation created, if any
 */
public record OperationResult(
    int sequence,
    OperationKind kind,
    EntityRef ref,
    OperationStatus status,
    String summary,
    ProviderErrorKind errorKind,
    String errorMessage,
    int attempts,
    boolean simulated,
    String remoteId
) {

    public static OperationResult succeeded(Operation op, int attempts, String remoteId) {
        return new OperationResult(op.sequence(), op.kind(), op.ref(), OperationStatus.SUCCEEDED,
            op.summary(), null, null, attempts, false, remoteId);
    }

    public static OperationResult failed(Operation op, ProviderErrorKind errorKind, String message, int attempts) {
        return new OperationResult(op.sequence(), op.kind(), op.ref(), OperationStatus.FAILED,
            op.summary(), errorKind, message, attempts, false, null);
    }

    public static OperationResult simulated(Operation op, String remoteId) {
        return new OperationResult(op.sequence(), op.kind(), op.ref(), OperationStatus.SIMULATED,
            op.summary(), null, null, 0, true, remoteId);
    }

    public static OperationResult blocked(Operation op, EntityRef prerequisite) {
        return new OperationResult(op.sequence(), op.kind(), op.ref(), OperationStatus.BLOCKED,
            op.summary(), null, "prerequisite " + prerequisite + " did not complete", 0, false, null);
    }

    public EntityType entityType() {
        return ref.type();
    }

    public boolean isFailure() {
        return status == OperationStatus.FAILED || status == OperationStatus.BLOCKED;
    }
}
