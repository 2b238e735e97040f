package tech.rolesync.engine;

import org.jboss.logging.Logger;
import tech.rolesync.engine.config.EngineSettings;
import tech.rolesync.engine.exec.RemoteIdRegistry;
import tech.rolesync.engine.exec.RetryingCaller;
import tech.rolesync.engine.provider.IdentityProviderClient;
import tech.rolesync.engine.report.RunReportCollector;

import java.time.Instant;

/**
 * Everything one run shares between its stages. Built once per run, never reused.
 */
public final class ReconcilerContext {

    private static final Logger LOG = Logger.getLogger(ReconcilerContext.class);

    private final String runId;
    private final Instant startedAt;
    private final ReconcileOptions options;
    private final EngineSettings settings;
    private final IdentityProviderClient client;
    private final RemoteIdRegistry ids;
    private final CancellationSignal cancellation;
    private final RetryingCaller retryingCaller;
    private final RunReportCollector collector;

    private volatile RunState state = RunState.VALIDATED;

    public ReconcilerContext(String runId, ReconcileOptions options, EngineSettings settings,
                             IdentityProviderClient client, CancellationSignal cancellation) {
        this.runId = runId;
        this.startedAt = Instant.now();
        this.options = options;
        this.settings = settings;
        this.client = client;
        this.ids = new RemoteIdRegistry();
        this.cancellation = cancellation != null ? cancellation : CancellationSignal.none();
        this.retryingCaller = new RetryingCaller(settings.retryPolicy(), settings.rateLimitPerMinute());
        this.collector = new RunReportCollector();
    }

    /**
     * Move to the next lifecycle state.
     *
     * @throws IllegalStateException if the run already reached a terminal state
     */
    public void transition(RunState next) {
        RunState current = state;
        if (current.isTerminal()) {
            throw new IllegalStateException("Run " + runId + " already " + current + ", cannot move to " + next);
        }
        LOG.debugf("Run [%s]: %s -> %s", runId, current, next);
        state = next;
    }

    public String runId() {
        return runId;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public ReconcileOptions options() {
        return options;
    }

    public EngineSettings settings() {
        return settings;
    }

    public IdentityProviderClient client() {
        return client;
    }

    public RemoteIdRegistry ids() {
        return ids;
    }

    public CancellationSignal cancellation() {
        return cancellation;
    }

    public RetryingCaller retryingCaller() {
        return retryingCaller;
    }

    public RunReportCollector collector() {
        return collector;
    }

    public RunState state() {
        return state;
    }
}
