package tech.rolesync.engine.plan;

public enum OperationKind {
    CREATE,
    UPDATE,
    DELETE
}
