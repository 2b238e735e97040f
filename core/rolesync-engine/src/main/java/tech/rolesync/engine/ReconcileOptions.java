package tech.rolesync.engine;

/**
 * Per-run switches.
 *
 * @param dryRun compute and report, but make no mutating call
 * @param cleanup allow deleting entities that exist only remotely
 * @param skipResources leave resources and their scopes untouched
 * @param skipRoles leave organization and user roles untouched
 * @param skipPermissions leave organization scopes and role bindings untouched
 * @param force continue past desired-state validation failures; never bypasses protection
 */
public record ReconcileOptions(
    boolean dryRun,
    boolean cleanup,
    boolean skipResources,
    boolean skipRoles,
    boolean skipPermissions,
    boolean force
) {

    public static ReconcileOptions defaults() {
        return new ReconcileOptions(false, false, false, false, false, false);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private boolean dryRun;
        private boolean cleanup;
        private boolean skipResources;
        private boolean skipRoles;
        private boolean skipPermissions;
        private boolean force;

        private Builder() {}

        public Builder dryRun(boolean dryRun) {
            this.dryRun = dryRun;
            return this;
        }

        public Builder cleanup(boolean cleanup) {
            this.cleanup = cleanup;
            return this;
        }

        public Builder skipResources(boolean skipResources) {
            this.skipResources = skipResources;
            return this;
        }

        public Builder skipRoles(boolean skipRoles) {
            this.skipRoles = skipRoles;
            return this;
        }

        public Builder skipPermissions(boolean skipPermissions) {
            this.skipPermissions = skipPermissions;
            return this;
        }

        public Builder force(boolean force) {
            this.force = force;
            return this;
        }

        public ReconcileOptions build() {
            return new ReconcileOptions(dryRun, cleanup, skipResources, skipRoles, skipPermissions, force);
        }
    }
}
