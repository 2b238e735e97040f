package tech.rolesync.engine;

import com.github.f4b6a3.tsid.TsidCreator;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.rolesync.engine.config.DesiredStateLoader;
import tech.rolesync.engine.config.DesiredStateValidator;
import tech.rolesync.engine.config.EngineConfig;
import tech.rolesync.engine.config.EngineSettings;
import tech.rolesync.engine.diff.DiffResult;
import tech.rolesync.engine.diff.Differ;
import tech.rolesync.engine.errors.StateLoadException;
import tech.rolesync.engine.errors.ValidationException;
import tech.rolesync.engine.errors.Violation;
import tech.rolesync.engine.exec.ExecutionOutcome;
import tech.rolesync.engine.exec.OperationExecutor;
import tech.rolesync.engine.guard.GuardResult;
import tech.rolesync.engine.guard.SafetyGuard;
import tech.rolesync.engine.model.DesiredState;
import tech.rolesync.engine.plan.DependencyOrderer;
import tech.rolesync.engine.plan.ExecutionPlan;
import tech.rolesync.engine.provider.IdentityProviderClient;
import tech.rolesync.engine.report.RunReport;
import tech.rolesync.engine.state.ActualState;
import tech.rolesync.engine.state.RemoteStateReader;

import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

/**
 * Entry point of the engine: converges the identity provider to a desired state.
 *
 * <p>A run goes through validate, load actual state, diff, guard, order, apply and
 * report. Only validation and state loading throw; per-operation failures end up in
 * the returned {@link RunReport}.
 *
 * <pre>
 * &#64;Inject Reconciler reconciler;
 *
 * RunReport report = reconciler.reconcile(Path.of("config.yml"),
 *     ReconcileOptions.builder().dryRun(true).build());
 * </pre>
 */
@ApplicationScoped
public class Reconciler {

    private static final Logger LOG = Logger.getLogger(Reconciler.class);

    private final IdentityProviderClient client;
    private final EngineSettings settings;
    private final DesiredStateLoader loader;
    private final DesiredStateValidator validator;
    private final RemoteStateReader reader;
    private final Differ differ;
    private final SafetyGuard guard;
    private final DependencyOrderer orderer;
    private final OperationExecutor executor;

    @Inject
    public Reconciler(IdentityProviderClient client, EngineConfig config, DesiredStateLoader loader,
                      DesiredStateValidator validator, RemoteStateReader reader, Differ differ,
                      SafetyGuard guard, DependencyOrderer orderer, OperationExecutor executor) {
        this.client = client;
        this.settings = EngineSettings.from(config);
        this.loader = loader;
        this.validator = validator;
        this.reader = reader;
        this.differ = differ;
        this.guard = guard;
        this.orderer = orderer;
        this.executor = executor;
    }

    /**
     * Wire a reconciler without a container.
     */
    public Reconciler(IdentityProviderClient client, EngineSettings settings) {
        this.client = client;
        this.settings = settings;
        this.loader = new DesiredStateLoader();
        this.validator = new DesiredStateValidator(settings.protection());
        this.reader = new RemoteStateReader();
        this.differ = new Differ(settings);
        this.guard = new SafetyGuard(settings.protection());
        this.orderer = new DependencyOrderer();
        this.executor = new OperationExecutor();
    }

    /**
     * Load a desired-state file and reconcile it.
     *
     * @throws ValidationException if the file is unreadable, malformed or invalid
     * @throws StateLoadException if actual state cannot be read
     */
    public RunReport reconcile(Path configFile, ReconcileOptions options) {
        return reconcile(loader.load(configFile), options);
    }

    public RunReport reconcile(DesiredState desired, ReconcileOptions options) {
        return reconcile(desired, options, CancellationSignal.none());
    }

    public RunReport reconcile(DesiredState desired, ReconcileOptions options, CancellationSignal cancellation) {
        String runId = TsidCreator.getTsid().toString();
        MDC.put("runId", runId);
        try {
            return run(runId, desired, options, cancellation);
        } finally {
            MDC.remove("runId");
        }
    }

    private RunReport run(String runId, DesiredState desired, ReconcileOptions options,
                          CancellationSignal cancellation) {
        LOG.infof("Starting run [%s]: dryRun=%s cleanup=%s force=%s", runId,
            options.dryRun(), options.cleanup(), options.force());

        DesiredState target = validate(desired, options);
        ReconcilerContext ctx = new ReconcilerContext(runId, options, settings, client, cancellation);

        ActualState actual;
        try {
            actual = reader.fetch(ctx, !target.thirdPartyApps().isEmpty());
        } catch (StateLoadException e) {
            ctx.transition(RunState.ABORTED);
            LOG.errorf("Run [%s] aborted: %s", runId, e.getMessage());
            throw e;
        }
        ctx.transition(RunState.STATE_LOADED);
        ctx.ids().seed(actual);

        if (cancellation.isCancelled()) {
            return finish(ctx, RunState.ABORTED, true, "cancelled before diffing");
        }

        DiffResult diff = differ.diff(target, actual, options);
        ctx.transition(RunState.DIFFED);
        ctx.collector().recordUnchanged(diff.unchanged());
        ctx.collector().addSkipped(diff.skipped());

        GuardResult guarded = guard.filter(diff.changes(), options.cleanup());
        ctx.transition(RunState.GUARDED);
        ctx.collector().addProtected(guarded.protectedItems());
        ctx.collector().addWouldRemove(guarded.wouldRemove());

        ExecutionPlan plan = orderer.order(guarded.allowed());
        ctx.transition(RunState.ORDERED);
        ctx.collector().recordPlan(plan);
        LOG.infof("Run [%s]: %d change(s) planned, %d protected, %d withheld without cleanup, %d skipped",
            runId, plan.size(), guarded.protectedItems().size(), guarded.wouldRemove().size(),
            diff.skipped().size());

        ctx.transition(RunState.APPLYING);
        ExecutionOutcome outcome = executor.apply(plan, ctx);

        if (outcome.cancelled()) {
            return finish(ctx, RunState.ABORTED, true, "cancelled");
        }
        if (outcome.aborted()) {
            return finish(ctx, RunState.ABORTED, false, outcome.abortReason());
        }
        return finish(ctx, RunState.REPORTED, false, null);
    }

    /**
     * @return the state to reconcile; pruned of unusable entries when forced
     */
    private DesiredState validate(DesiredState desired, ReconcileOptions options) {
        List<Violation> violations = validator.validate(desired);
        if (violations.isEmpty()) {
            return desired;
        }
        if (!options.force()) {
            throw new ValidationException(violations);
        }
        for (Violation violation : violations) {
            LOG.warnf("Ignoring invalid desired state (forced): %s", violation);
        }
        return validator.prune(desired);
    }

    private RunReport finish(ReconcilerContext ctx, RunState state, boolean cancelled, String reason) {
        ctx.transition(state);
        RunReport report = ctx.collector().build(ctx.runId(), ctx.startedAt(), Instant.now(),
            ctx.options().dryRun(), ctx.options().cleanup(), state, cancelled, reason);

        if (report.success()) {
            LOG.infof("Run [%s] completed successfully in %d ms (%d operations)",
                ctx.runId(), report.durationMillis(), report.operations().size());
        } else {
            LOG.errorf("Run [%s] completed with %d failed or blocked operation(s) in %d ms, state %s",
                ctx.runId(), report.failures().size(), report.durationMillis(), state);
        }
        return report;
    }
}
