package tech.rolesync.engine.exec;

import jakarta.enterprise.context.ApplicationScoped;
import org.jboss.logging.Logger;
import org.jboss.logging.MDC;
import tech.rolesync.engine.ReconcilerContext;
import tech.rolesync.engine.plan.EntityRef;
import tech.rolesync.engine.plan.ExecutionPlan;
import tech.rolesync.engine.plan.Operation;
import tech.rolesync.engine.plan.OperationKind;
import tech.rolesync.engine.plan.PhaseBatch;
import tech.rolesync.engine.provider.ProviderErrorKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Applies an execution plan batch by batch.
 *
 * <p>Operations inside a batch run on a bounded worker pool; the next batch starts
 * only when every operation of the current one has finished. A failed operation
 * blocks the operations that depend on it but never the rest of its batch.
 *
 * <p>A batch in which every attempted operation was rejected as unauthorized
 * aborts the run: the credentials are not going to work for later batches either.
 */
@ApplicationScoped
public class OperationExecutor {

    private static final Logger LOG = Logger.getLogger(OperationExecutor.class);

    public ExecutionOutcome apply(ExecutionPlan plan, ReconcilerContext ctx) {
        OperationHandler handler = new ProviderOperationHandler(ctx.client(), ctx.ids());
        return apply(plan, ctx, handler);
    }

    ExecutionOutcome apply(ExecutionPlan plan, ReconcilerContext ctx, OperationHandler handler) {
        boolean dryRun = ctx.options().dryRun();
        Set<EntityRef> incomplete = ConcurrentHashMap.newKeySet();
        List<OperationResult> results = new ArrayList<>();
        boolean cancelled = false;
        String abortReason = null;

        if (plan.isEmpty()) {
            return new ExecutionOutcome(results, false, false, null);
        }

        int workers = Math.max(1, ctx.settings().concurrency());
        ExecutorService pool = Executors.newFixedThreadPool(workers, workerThreads(ctx.runId()));
        try {
            for (PhaseBatch batch : plan.batches()) {
                if (ctx.cancellation().isCancelled()) {
                    cancelled = true;
                    break;
                }
                LOG.infof("%s %s: %d operation(s)", dryRun ? "Simulating" : "Applying",
                    batch.name(), batch.operations().size());

                List<Future<OperationResult>> futures = new ArrayList<>();
                for (Operation op : batch.operations()) {
                    futures.add(pool.submit(() -> run(op, ctx, handler, incomplete)));
                }

                List<OperationResult> batchResults = new ArrayList<>();
                for (int i = 0; i < futures.size(); i++) {
                    OperationResult result = await(futures.get(i), batch.operations().get(i));
                    if (result == null) {
                        cancelled = true;
                        continue;
                    }
                    batchResults.add(result);
                    ctx.collector().record(result);
                }
                results.addAll(batchResults);

                if (cancelled || ctx.cancellation().isCancelled()) {
                    cancelled = true;
                    break;
                }
                Optional<String> fatal = fatalFailure(batch, batchResults);
                if (fatal.isPresent()) {
                    abortReason = fatal.get();
                    LOG.errorf("Aborting run [%s]: %s", ctx.runId(), abortReason);
                    break;
                }
            }
        } finally {
            shutdown(pool);
        }

        if (cancelled) {
            LOG.warnf("Run [%s] cancelled after %d operation(s)", ctx.runId(), results.size());
        }
        return new ExecutionOutcome(results, cancelled, abortReason != null, abortReason);
    }

    /**
     * @return null if the run was cancelled before the operation started
     */
    private OperationResult run(Operation op, ReconcilerContext ctx, OperationHandler handler,
                                Set<EntityRef> incomplete) {
        if (ctx.cancellation().isCancelled()) {
            return null;
        }

        MDC.put("runId", ctx.runId());
        MDC.put("operation", op.kind() + " " + op.ref());
        try {
            for (EntityRef dependency : op.dependsOn()) {
                if (incomplete.contains(dependency)) {
                    incomplete.add(op.ref());
                    LOG.infof("Blocked: %s (needs %s)", op.summary(), dependency);
                    return OperationResult.blocked(op, dependency);
                }
            }

            if (ctx.options().dryRun()) {
                String simulatedId = null;
                if (op.kind() == OperationKind.CREATE) {
                    simulatedId = "dry-run-" + op.entityType().name().toLowerCase(Locale.ROOT) + "-" + op.ref().key();
                    ctx.ids().register(op.ref(), simulatedId);
                }
                LOG.infof("DRY RUN: would %s", op.summary());
                return OperationResult.simulated(op, simulatedId);
            }

            RetryingCaller.Outcome<String> outcome;
            try {
                outcome = ctx.retryingCaller().call(op.summary(), () -> handler.apply(op));
            } catch (RuntimeException e) {
                incomplete.add(op.ref());
                LOG.errorf(e, "Failed: %s", op.summary());
                return OperationResult.failed(op, null, e.getMessage(), 1);
            }

            if (outcome.succeeded()) {
                LOG.infof("Done: %s", op.summary());
                return OperationResult.succeeded(op, outcome.attempts(), outcome.value());
            }
            incomplete.add(op.ref());
            LOG.warnf("Failed: %s after %d attempt(s): %s [%s]", op.summary(), outcome.attempts(),
                outcome.failure().getMessage(), outcome.failure().getError().kind());
            return OperationResult.failed(op, outcome.failure().getError().kind(),
                outcome.failure().getMessage(), outcome.attempts());
        } finally {
            MDC.remove("operation");
            MDC.remove("runId");
        }
    }

    private OperationResult await(Future<OperationResult> future, Operation op) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.warnf("Interrupted while waiting for %s", op.summary());
            return null;
        } catch (ExecutionException e) {
            // run() handles its own failures; anything here is a bug in the handler wiring
            return OperationResult.failed(op, null, String.valueOf(e.getCause()), 0);
        }
    }

    private Optional<String> fatalFailure(PhaseBatch batch, List<OperationResult> batchResults) {
        List<OperationResult> attempted = batchResults.stream()
            .filter(r -> r.status() == OperationStatus.SUCCEEDED || r.status() == OperationStatus.FAILED)
            .toList();
        if (attempted.isEmpty()) {
            return Optional.empty();
        }
        boolean allUnauthorized = attempted.stream()
            .allMatch(r -> r.errorKind() == ProviderErrorKind.UNAUTHORIZED);
        if (!allUnauthorized) {
            return Optional.empty();
        }
        return Optional.of("every operation in " + batch.name() + " was rejected as unauthorized");
    }

    private static ThreadFactory workerThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, "rolesync-worker-" + runId + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    private static void shutdown(ExecutorService pool) {
        pool.shutdown();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                LOG.warn("Worker pool did not terminate within 10 seconds");
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
