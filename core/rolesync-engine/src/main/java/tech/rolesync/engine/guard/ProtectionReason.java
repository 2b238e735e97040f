package tech.rolesync.engine.guard;

/**
 * Why a change was withheld from execution.
 */
public enum ProtectionReason {
    /** Matches a name or indicator owned by the provider. */
    RESERVED_NAME,
    /** Flagged as default by the provider. */
    DEFAULT_ENTITY,
    /** Belongs to a protected resource. */
    PROTECTED_OWNER,
    /** Looks provider-owned by name or description; only deletes are withheld. */
    SYSTEM_ENTITY,
    /** Destructive, and cleanup was not enabled. */
    CLEANUP_DISABLED
}
