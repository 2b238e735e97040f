package tech.rolesync.engine.exec;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.rolesync.engine.CancellationSignal;
import tech.rolesync.engine.ReconcileOptions;
import tech.rolesync.engine.ReconcilerContext;
import tech.rolesync.engine.config.EngineSettings;
import tech.rolesync.engine.diff.Change;
import tech.rolesync.engine.plan.DependencyOrderer;
import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.EntityType;
import tech.rolesync.engine.plan.ExecutionPlan;
import tech.rolesync.engine.plan.OperationPayload;
import tech.rolesync.engine.provider.ProviderError;
import tech.rolesync.engine.provider.ProviderErrorKind;
import tech.rolesync.engine.support.InMemoryIdentityProvider;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for OperationExecutor against an in-memory provider.
 * A single worker keeps the order of calls inside a batch deterministic.
 */
class OperationExecutorTest {

    private static final EngineSettings SETTINGS = EngineSettings.defaults()
        .withRetryPolicy(RetryPolicy.noDelay(3))
        .withConcurrency(1);

    private final OperationExecutor executor = new OperationExecutor();
    private final DependencyOrderer orderer = new DependencyOrderer();
    private InMemoryIdentityProvider provider;

    @BeforeEach
    void setUp() {
        provider = new InMemoryIdentityProvider();
    }

    // ========================================
    // LIVE RUNS
    // ========================================

    @Test
    @DisplayName("apply should create a resource and then its scope using the new id")
    void apply_shouldCreateResourceThenScope() {
        // Arrange
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), CancellationSignal.none());
        ExecutionPlan plan = orderer.order(resourceWithScope("systems", "read"));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.results()).extracting(OperationResult::status)
            .containsOnly(OperationStatus.SUCCEEDED);
        assertThat(provider.scopeNames("systems")).containsExactly("systems:read");
        assertThat(ctx.ids().find(EntityRef.of(EntityType.SCOPE, "systems:read"))).isPresent();
        assertThat(ctx.collector().results()).hasSize(2);
    }

    @Test
    @DisplayName("apply should block dependents of a failed operation but finish the rest of the batch")
    void apply_shouldBlockDependents_whenPrerequisiteFails() {
        // Arrange
        provider.failNext("createResource", new ProviderError.Rejected(400, "guard.invalid_input"));
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), CancellationSignal.none());
        List<Change> changes = new ArrayList<>(resourceWithScope("billing", "read"));
        changes.addAll(resourceWithScope("systems", "read"));
        ExecutionPlan plan = orderer.order(changes);

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.aborted()).isFalse();
        assertThat(outcome.results())
            .extracting(r -> r.ref().key(), OperationResult::status)
            .containsExactly(
                tuple("billing", OperationStatus.FAILED),
                tuple("systems", OperationStatus.SUCCEEDED),
                tuple("billing:read", OperationStatus.BLOCKED),
                tuple("systems:read", OperationStatus.SUCCEEDED));
        assertThat(outcome.results().get(0).errorKind()).isEqualTo(ProviderErrorKind.REJECTED);
        assertThat(provider.resourceNames()).containsExactly("systems");
    }

    @Test
    @DisplayName("apply should retry transient failures and report the attempts")
    void apply_shouldRetryTransientFailure() {
        // Arrange
        provider.failNext("createResource",
            new ProviderError.ServerError(503, "unavailable"),
            new ProviderError.RateLimited("slow down", null));
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), CancellationSignal.none());
        ExecutionPlan plan = orderer.order(List.of(resourceCreate("systems")));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.results()).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(OperationStatus.SUCCEEDED);
            assertThat(r.attempts()).isEqualTo(3);
        });
    }

    @Test
    @DisplayName("apply should fail after the retry policy is exhausted")
    void apply_shouldFail_whenRetriesExhausted() {
        // Arrange
        provider.failAlways("createResource", new ProviderError.ServerError(500, "boom"));
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), CancellationSignal.none());
        ExecutionPlan plan = orderer.order(List.of(resourceCreate("systems")));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.results()).singleElement().satisfies(r -> {
            assertThat(r.status()).isEqualTo(OperationStatus.FAILED);
            assertThat(r.errorKind()).isEqualTo(ProviderErrorKind.SERVER_ERROR);
            assertThat(r.attempts()).isEqualTo(3);
        });
        assertThat(provider.mutationCount("createResource")).isEqualTo(3);
    }

    @Test
    @DisplayName("apply should abort when every operation of a batch is unauthorized")
    void apply_shouldAbort_whenBatchUnauthorized() {
        // Arrange
        provider.failAlways("createResource", new ProviderError.Unauthorized(403, "auth.forbidden"));
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), CancellationSignal.none());
        ExecutionPlan plan = orderer.order(resourceWithScope("systems", "read"));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.aborted()).isTrue();
        assertThat(outcome.abortReason()).contains("unauthorized");
        assertThat(outcome.results()).hasSize(1);
        assertThat(provider.mutationCount("createResourceScope")).isZero();
    }

    @Test
    @DisplayName("apply should treat deleting an already missing entity as done")
    void apply_shouldSucceed_whenDeletedEntityAlreadyGone() {
        // Arrange
        ReconcilerContext ctx = context(ReconcileOptions.builder().cleanup(true).build(), CancellationSignal.none());
        EntityRef ref = EntityRef.of(EntityType.RESOURCE, "ghost");
        ctx.ids().register(ref, "res-gone");
        ExecutionPlan plan = orderer.order(List.of(Change.delete(ref,
            new OperationPayload.Resource("ghost", "https://rolesync.local/api/ghost", 3600, false),
            List.of(), "Delete resource ghost")));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.results()).singleElement()
            .extracting(OperationResult::status).isEqualTo(OperationStatus.SUCCEEDED);
        assertThat(ctx.ids().find(ref)).isEmpty();
    }

    // ========================================
    // DRY RUN
    // ========================================

    @Test
    @DisplayName("apply should simulate every operation in dry-run mode without calling the provider")
    void apply_shouldSimulate_whenDryRun() {
        // Arrange
        ReconcilerContext ctx = context(ReconcileOptions.builder().dryRun(true).build(), CancellationSignal.none());
        ExecutionPlan plan = orderer.order(resourceWithScope("systems", "read"));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.results()).extracting(OperationResult::status)
            .containsExactly(OperationStatus.SIMULATED, OperationStatus.SIMULATED);
        assertThat(outcome.results()).allMatch(OperationResult::simulated);
        assertThat(provider.mutations()).isEmpty();
        assertThat(ctx.ids().find(EntityRef.of(EntityType.RESOURCE, "systems")))
            .contains("dry-run-resource-systems");
    }

    // ========================================
    // CANCELLATION
    // ========================================

    @Test
    @DisplayName("apply should start nothing when cancelled beforehand")
    void apply_shouldDoNothing_whenCancelledBeforeStart() {
        // Arrange
        CancellationSignal signal = new CancellationSignal();
        signal.cancel();
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), signal);
        ExecutionPlan plan = orderer.order(resourceWithScope("systems", "read"));

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        // Assert
        assertThat(outcome.cancelled()).isTrue();
        assertThat(outcome.results()).isEmpty();
        assertThat(provider.mutations()).isEmpty();
    }

    @Test
    @DisplayName("apply should finish the running batch and start no further batch after cancellation")
    void apply_shouldStopAfterBatch_whenCancelledMidRun() {
        // Arrange
        CancellationSignal signal = new CancellationSignal();
        ReconcilerContext ctx = context(ReconcileOptions.defaults(), signal);
        ExecutionPlan plan = orderer.order(resourceWithScope("systems", "read"));
        AtomicInteger calls = new AtomicInteger();
        OperationHandler handler = op -> {
            calls.incrementAndGet();
            signal.cancel();
            return "id-" + op.sequence();
        };

        // Act
        ExecutionOutcome outcome = executor.apply(plan, ctx, handler);

        // Assert
        assertThat(outcome.cancelled()).isTrue();
        assertThat(outcome.results()).singleElement()
            .extracting(OperationResult::status).isEqualTo(OperationStatus.SUCCEEDED);
        assertThat(calls).hasValue(1);
    }

    // ========================================
    // HELPERS
    // ========================================

    private ReconcilerContext context(ReconcileOptions options, CancellationSignal signal) {
        return new ReconcilerContext("run-test", options, SETTINGS, provider, signal);
    }

    private static Change resourceCreate(String name) {
        return Change.create(EntityRef.of(EntityType.RESOURCE, name),
            new OperationPayload.Resource(name, "https://rolesync.local/api/" + name, 3600, false),
            List.of(), "Create resource " + name);
    }

    private static List<Change> resourceWithScope(String name, String action) {
        String scopeName = name + ":" + action;
        return List.of(
            resourceCreate(name),
            Change.create(EntityRef.of(EntityType.SCOPE, scopeName),
                new OperationPayload.Scope(name, scopeName, "Permission to " + action + " " + name,
                    "https://rolesync.local/api/" + name, false),
                List.of(EntityRef.of(EntityType.RESOURCE, name)), "Create scope " + scopeName));
    }
}
