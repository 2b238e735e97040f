package tech.rolesync.engine;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.rolesync.engine.config.DesiredStateLoader;
import tech.rolesync.engine.config.EngineSettings;
import tech.rolesync.engine.diff.Differ;
import tech.rolesync.engine.errors.StateLoadException;
import tech.rolesync.engine.errors.ValidationException;
import tech.rolesync.engine.exec.OperationResult;
import tech.rolesync.engine.exec.OperationStatus;
import tech.rolesync.engine.exec.RetryPolicy;
import tech.rolesync.engine.model.DesiredState;
import tech.rolesync.engine.model.ResourceDefinition;
import tech.rolesync.engine.model.RoleDefinition;
import tech.rolesync.engine.model.RoleType;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.provider.ProviderError;
import tech.rolesync.engine.report.ReportItem;
import tech.rolesync.engine.report.RunReport;
import tech.rolesync.engine.support.InMemoryIdentityProvider;

import java.net.URISyntaxException;
import java.nio.file.Path;
import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * End-to-end tests of a reconciliation run against an in-memory provider.
 */
class ReconcilerTest {

    private static final EngineSettings SETTINGS = EngineSettings.defaults()
        .withRetryPolicy(RetryPolicy.noDelay(2));

    private static final ReconcileOptions LIVE = ReconcileOptions.defaults();
    private static final ReconcileOptions CLEANUP = ReconcileOptions.builder().cleanup(true).build();
    private static final ReconcileOptions DRY_RUN = ReconcileOptions.builder().dryRun(true).build();

    private InMemoryIdentityProvider provider;
    private Reconciler reconciler;

    @BeforeEach
    void setUp() {
        provider = new InMemoryIdentityProvider();
        reconciler = new Reconciler(provider, SETTINGS);
    }

    // ========================================
    // CONVERGENCE
    // ========================================

    @Test
    @DisplayName("reconcile should add only the missing scope to an existing resource")
    void reconcile_shouldAddMissingScope() {
        // Arrange
        provider.seedResource("systems", "https://rolesync.local/api/systems", false, 3600, "systems:read");
        DesiredState desired = resources(ResourceDefinition.of("systems", "read", "manage"));

        // Act
        RunReport report = reconciler.reconcile(desired, LIVE);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(report.state()).isEqualTo(RunState.REPORTED);
        assertThat(report.operations()).singleElement().satisfies(op -> {
            assertThat(op.ref().key()).isEqualTo("systems:manage");
            assertThat(op.status()).isEqualTo(OperationStatus.SUCCEEDED);
        });
        assertThat(report.countsFor(EntityType.SCOPE).created()).isEqualTo(1);
        assertThat(report.countsFor(EntityType.RESOURCE).unchanged()).isEqualTo(1);
        assertThat(provider.scopeNames("systems")).containsExactly("systems:read", "systems:manage");
    }

    @Test
    @DisplayName("reconcile should build the whole hierarchy and converge so that a second run changes nothing")
    void reconcile_shouldConverge_whenRunTwice() throws Exception {
        // Arrange
        DesiredState desired = new DesiredStateLoader().load(fixture());

        // Act
        RunReport first = reconciler.reconcile(desired, LIVE);
        RunReport second = reconciler.reconcile(desired, LIVE);

        // Assert
        assertThat(first.success()).isTrue();
        assertThat(first.operations()).isNotEmpty();
        assertThat(second.success()).isTrue();
        assertThat(second.operations()).isEmpty();
        assertThat(second.counts().values()).allSatisfy(c -> assertThat(c.changes()).isZero());
        assertThat(new Differ(SETTINGS).diff(desired, provider.snapshot(), LIVE).isEmpty()).isTrue();

        assertThat(provider.boundScopes(RoleType.USER, "admin"))
            .containsExactly("systems:read", "systems:manage", "billing:read");
        assertThat(provider.boundScopes(RoleType.ORGANIZATION, "member")).containsExactly("systems:read");
        assertThat(provider.resource("billing")).get().extracting(r -> r.accessTokenTtl()).isEqualTo(7200);
        assertThat(provider.displayNameOf("partner-portal")).isEqualTo("Partner Portal");
        assertThat(provider.application("partner-portal")).get()
            .extracting(a -> a.customData().get("login_url"))
            .isEqualTo("https://portal.example.com/login");
    }

    @Test
    @DisplayName("reconcile should create parents before children and bind last")
    void reconcile_shouldCallProviderInDependencyOrder() throws Exception {
        // Arrange
        DesiredState desired = new DesiredStateLoader().load(fixture());

        // Act
        reconciler.reconcile(desired, LIVE);

        // Assert
        List<String> mutations = provider.mutations();
        int resource = mutations.indexOf("createResource systems");
        int scope = mutations.indexOf("createResourceScope systems:read");
        int role = mutations.indexOf("createRole admin");
        int firstBinding = indexOfFirst(mutations, "assignRoleScopes");
        int app = mutations.indexOf("createApplication partner-portal");
        int access = indexOfFirst(mutations, "updateApplicationCustomData");

        assertThat(resource).isNotNegative().isLessThan(scope);
        assertThat(scope).isLessThan(firstBinding);
        assertThat(role).isNotNegative().isLessThan(firstBinding);
        assertThat(firstBinding).isLessThan(app);
        assertThat(app).isLessThan(access);
    }

    // ========================================
    // CLEANUP
    // ========================================

    @Test
    @DisplayName("reconcile should only report a remote-only role when cleanup is disabled")
    void reconcile_shouldReportWouldRemove_whenCleanupDisabled() {
        // Arrange
        provider.seedResource("systems", "https://rolesync.local/api/systems", false, 3600, "systems:read");
        provider.seedRole(RoleType.USER, "legacy-role", "Legacy", false);

        // Act
        RunReport report = reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), LIVE);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(report.wouldRemove())
            .extracting(ReportItem::entityType, ReportItem::key)
            .containsExactly(tuple(EntityType.USER_ROLE, "legacy-role"));
        assertThat(report.countsFor(EntityType.USER_ROLE).deleted()).isZero();
        assertThat(provider.mutationCount("deleteRole")).isZero();
        assertThat(provider.roleNames(RoleType.USER)).containsExactly("legacy-role");
    }

    @Test
    @DisplayName("reconcile should delete a remote-only role when cleanup is enabled")
    void reconcile_shouldDeleteRole_whenCleanupEnabled() {
        // Arrange
        provider.seedResource("systems", "https://rolesync.local/api/systems", false, 3600, "systems:read");
        provider.seedRole(RoleType.USER, "legacy-role", "Legacy", false);

        // Act
        RunReport report = reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), CLEANUP);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(report.countsFor(EntityType.USER_ROLE).deleted()).isEqualTo(1);
        assertThat(provider.mutationCount("deleteRole")).isEqualTo(1);
        assertThat(provider.roleNames(RoleType.USER)).isEmpty();
    }

    @Test
    @DisplayName("reconcile should never touch provider-owned entities even with cleanup")
    void reconcile_shouldLeaveProtectedEntities_whenCleanupEnabled() {
        // Arrange
        provider.seedResource("Logto Management API", "https://default.logto.app/api", true, 3600, "all");
        provider.seedRole(RoleType.USER, "Logto Admin", "Provider role", false, "all");

        // Act
        RunReport report = reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), CLEANUP);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(report.protectedItems())
            .extracting(ReportItem::key)
            .contains("Logto Management API", "all", "logto admin");
        assertThat(provider.resourceNames()).contains("Logto Management API");
        assertThat(provider.scopeNames("Logto Management API")).containsExactly("all");
        assertThat(provider.boundScopes(RoleType.USER, "Logto Admin")).containsExactly("all");
        assertThat(provider.mutationCount("deleteResource")).isZero();
        assertThat(provider.mutationCount("deleteRole")).isZero();
    }

    @Test
    @DisplayName("reconcile should keep system-looking tenant roles when cleanup removes the rest")
    void reconcile_shouldKeepSystemRoles_whenCleanupEnabled() {
        // Arrange
        provider.seedResource("systems", "https://rolesync.local/api/systems", false, 3600, "systems:read");
        provider.seedRole(RoleType.USER, "Admin", "Tenant administrators", false);
        provider.seedRole(RoleType.USER, "ops", "System role", false);
        provider.seedRole(RoleType.USER, "legacy-role", "Legacy", false);
        provider.seedRole(RoleType.ORGANIZATION, "Owner", "Organization owner", false);
        provider.seedRole(RoleType.ORGANIZATION, "Member", "Default member role", false);

        // Act
        RunReport report = reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), CLEANUP);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(provider.roleNames(RoleType.USER)).containsExactlyInAnyOrder("Admin", "ops");
        assertThat(provider.roleNames(RoleType.ORGANIZATION)).containsExactlyInAnyOrder("Owner", "Member");
        assertThat(provider.mutationCount("deleteRole")).isEqualTo(1);
        assertThat(report.protectedItems())
            .filteredOn(item -> item.reason().equals("SYSTEM_ENTITY"))
            .extracting(ReportItem::key)
            .containsExactlyInAnyOrder("admin", "ops", "owner", "member");
    }

    // ========================================
    // DRY RUN
    // ========================================

    @Test
    @DisplayName("reconcile in dry-run mode should make no mutating call and predict the live counts")
    void reconcile_shouldNotMutateAndMatchCounts_whenDryRun() throws Exception {
        // Arrange
        DesiredState desired = new DesiredStateLoader().load(fixture());
        provider.seedRole(RoleType.USER, "legacy-role", "Legacy", false);

        // Act
        RunReport dry = reconciler.reconcile(desired, ReconcileOptions.builder().dryRun(true).cleanup(true).build());
        int mutationsAfterDryRun = provider.mutations().size();
        RunReport live = reconciler.reconcile(desired, CLEANUP);

        // Assert
        assertThat(mutationsAfterDryRun).isZero();
        assertThat(dry.dryRun()).isTrue();
        assertThat(dry.operations()).extracting(OperationResult::status).containsOnly(OperationStatus.SIMULATED);
        for (EntityType type : EntityType.values()) {
            assertThat(dry.countsFor(type).created()).as("created %s", type).isEqualTo(live.countsFor(type).created());
            assertThat(dry.countsFor(type).updated()).as("updated %s", type).isEqualTo(live.countsFor(type).updated());
            assertThat(dry.countsFor(type).deleted()).as("deleted %s", type).isEqualTo(live.countsFor(type).deleted());
        }
        assertThat(live.success()).isTrue();
    }

    @Test
    @DisplayName("reconcile in dry-run mode should still read actual state")
    void reconcile_shouldReadState_whenDryRun() {
        // Act
        RunReport report = reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), DRY_RUN);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(provider.calls()).anyMatch(c -> c.startsWith("listResources"));
        assertThat(provider.mutations()).isEmpty();
    }

    // ========================================
    // VALIDATION AND FORCE
    // ========================================

    @Test
    @DisplayName("reconcile should reject an invalid desired state before any provider call")
    void reconcile_shouldThrowBeforeNetwork_whenInvalid() {
        // Arrange
        DesiredState desired = invalidState();

        // Act & Assert
        assertThatThrownBy(() -> reconciler.reconcile(desired, LIVE))
            .isInstanceOf(ValidationException.class)
            .hasMessageContaining("ghost:read");
        assertThat(provider.calls()).isEmpty();
    }

    @Test
    @DisplayName("reconcile with force should go on and report what it could not reconcile")
    void reconcile_shouldContinueAndReportSkipped_whenForced() {
        // Arrange
        DesiredState desired = invalidState();

        // Act
        RunReport report = reconciler.reconcile(desired, ReconcileOptions.builder().force(true).build());

        // Assert
        assertThat(report.state()).isEqualTo(RunState.REPORTED);
        assertThat(report.skipped()).extracting(ReportItem::key).contains("user/admin");
        assertThat(provider.roleNames(RoleType.USER)).containsExactly("admin");
        assertThat(provider.boundScopes(RoleType.USER, "admin")).containsExactly("systems:read");
    }

    @Test
    @DisplayName("reconcile with force should neither create nor bind an organization scope that names no resource")
    void reconcile_shouldSkipUnresolvedOrganizationPermission_whenForced() {
        // Arrange
        DesiredState desired = new DesiredState(null, List.of(ResourceDefinition.of("systems", "read")),
            List.of(RoleDefinition.of("member", "Member", 1, "systems:read", "ghost:read")), List.of(), List.of());

        // Act
        RunReport report = reconciler.reconcile(desired, ReconcileOptions.builder().force(true).build());

        // Assert
        assertThat(report.state()).isEqualTo(RunState.REPORTED);
        assertThat(report.skipped())
            .extracting(ReportItem::entityType, ReportItem::key)
            .contains(tuple(EntityType.ROLE_PERMISSION, "org/member"));
        assertThat(provider.organizationScopeNames()).containsExactly("systems:read");
        assertThat(provider.boundScopes(RoleType.ORGANIZATION, "member")).containsExactly("systems:read");
    }

    // ========================================
    // FAILURES AND CANCELLATION
    // ========================================

    @Test
    @DisplayName("reconcile should throw and mutate nothing when actual state cannot be read")
    void reconcile_shouldThrow_whenStateLoadFails() {
        // Arrange
        provider.failAlways("listResources", new ProviderError.ServerError(500, "request.general"));

        // Act & Assert
        assertThatThrownBy(() -> reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), LIVE))
            .isInstanceOf(StateLoadException.class);
        assertThat(provider.mutations()).isEmpty();
    }

    @Test
    @DisplayName("reconcile should report failed and blocked operations without throwing")
    void reconcile_shouldReportFailure_whenOperationFails() {
        // Arrange
        provider.failAlways("createResource", new ProviderError.Rejected(400, "guard.invalid_input"));
        provider.seedResource("billing", "https://rolesync.local/api/billing", false, 3600, "billing:read");
        DesiredState desired = resources(
            ResourceDefinition.of("systems", "read"),
            ResourceDefinition.of("billing", "read", "write"));

        // Act
        RunReport report = reconciler.reconcile(desired, LIVE);

        // Assert
        assertThat(report.success()).isFalse();
        assertThat(report.state()).isEqualTo(RunState.REPORTED);
        assertThat(report.countsFor(EntityType.RESOURCE).failed()).isEqualTo(1);
        assertThat(report.countsFor(EntityType.SCOPE).blocked()).isEqualTo(1);
        assertThat(provider.scopeNames("billing")).containsExactly("billing:read", "billing:write");
    }

    @Test
    @DisplayName("reconcile should restore the previous bindings when rewriting their order fails")
    void reconcile_shouldRestoreBindings_whenReorderAssignFails() {
        // Arrange
        provider.seedResource("systems", "https://rolesync.local/api/systems", false, 3600,
            "systems:read", "systems:manage");
        RoleDefinition admin = RoleDefinition.of("admin", "Admin", 100, "systems:read", "systems:manage");
        provider.seedRole(RoleType.USER, "admin", admin.providerDescription(), false,
            "systems:manage", "systems:read");
        provider.failNext("assignRoleScopes", new ProviderError.Rejected(422, "guard.invalid_input"));
        DesiredState desired = new DesiredState(null,
            List.of(ResourceDefinition.of("systems", "read", "manage")), List.of(), List.of(admin), List.of());

        // Act
        RunReport report = reconciler.reconcile(desired, LIVE);

        // Assert
        assertThat(report.success()).isFalse();
        assertThat(report.countsFor(EntityType.ROLE_PERMISSION).failed()).isEqualTo(1);
        assertThat(provider.boundScopes(RoleType.USER, "admin"))
            .containsExactly("systems:manage", "systems:read");
    }

    @Test
    @DisplayName("reconcile should finish a reorder on retry after a transient assignment failure")
    void reconcile_shouldReorderBindings_whenAssignSucceedsOnRetry() {
        // Arrange
        provider.seedResource("systems", "https://rolesync.local/api/systems", false, 3600,
            "systems:read", "systems:manage");
        RoleDefinition admin = RoleDefinition.of("admin", "Admin", 100, "systems:read", "systems:manage");
        provider.seedRole(RoleType.USER, "admin", admin.providerDescription(), false,
            "systems:manage", "systems:read");
        provider.failNext("assignRoleScopes", new ProviderError.ServerError(503, "unavailable"));
        DesiredState desired = new DesiredState(null,
            List.of(ResourceDefinition.of("systems", "read", "manage")), List.of(), List.of(admin), List.of());

        // Act
        RunReport report = reconciler.reconcile(desired, LIVE);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(provider.boundScopes(RoleType.USER, "admin"))
            .containsExactly("systems:read", "systems:manage");
    }

    @Test
    @DisplayName("reconcile should abort the run when the credentials are rejected")
    void reconcile_shouldAbort_whenUnauthorized() {
        // Arrange
        provider.failAlways("createResource", new ProviderError.Unauthorized(401, "auth.unauthorized"));
        DesiredState desired = new DesiredState(null, List.of(ResourceDefinition.of("systems", "read")),
            List.of(), List.of(RoleDefinition.of("admin", "Admin", 1, "systems:read")), List.of());

        // Act
        RunReport report = reconciler.reconcile(desired, LIVE);

        // Assert
        assertThat(report.state()).isEqualTo(RunState.ABORTED);
        assertThat(report.success()).isFalse();
        assertThat(report.abortReason()).contains("unauthorized");
        assertThat(provider.mutationCount("createRole")).isZero();
    }

    @Test
    @DisplayName("reconcile should stop before applying when cancelled")
    void reconcile_shouldAbort_whenCancelled() {
        // Arrange
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();

        // Act
        RunReport report = reconciler.reconcile(resources(ResourceDefinition.of("systems", "read")), LIVE, signal);

        // Assert
        assertThat(report.state()).isEqualTo(RunState.ABORTED);
        assertThat(report.cancelled()).isTrue();
        assertThat(report.success()).isFalse();
        assertThat(provider.mutations()).isEmpty();
    }

    @Test
    @DisplayName("reconcile should give every run its own id")
    void reconcile_shouldAssignDistinctRunIds() {
        // Act
        RunReport first = reconciler.reconcile(resources(), LIVE);
        RunReport second = reconciler.reconcile(resources(), LIVE);

        // Assert
        assertThat(first.runId()).isNotBlank().isNotEqualTo(second.runId());
    }

    @Test
    @DisplayName("reconcile should load the desired state from a file")
    void reconcile_shouldLoadFile() throws Exception {
        // Act
        RunReport report = reconciler.reconcile(fixture(), DRY_RUN);

        // Assert
        assertThat(report.success()).isTrue();
        assertThat(report.countsFor(EntityType.RESOURCE).created()).isEqualTo(2);
        assertThat(report.countsFor(EntityType.APPLICATION).created()).isEqualTo(1);
    }

    // ========================================
    // HELPERS
    // ========================================

    private static DesiredState resources(ResourceDefinition... resources) {
        return new DesiredState(null, List.of(resources), List.of(), List.of(), List.of());
    }

    private static DesiredState invalidState() {
        return new DesiredState(null, List.of(ResourceDefinition.of("systems", "read")), List.of(),
            List.of(RoleDefinition.of("admin", "Admin", 1, "systems:read", "ghost:read")), List.of());
    }

    private Path fixture() throws URISyntaxException {
        return Path.of(getClass().getResource("/desired-state.yml").toURI());
    }

    private static int indexOfFirst(List<String> calls, String method) {
        for (int i = 0; i < calls.size(); i++) {
            if (calls.get(i).startsWith(method + " ")) {
                return i;
            }
        }
        return -1;
    }
}
