package tech.rolesync.engine;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation of a run. Operations already in flight finish;
 * nothing new starts once {@link #cancel()} has been called.
 */
public class CancellationSignal {

    private final AtomicBoolean cancelled = new AtomicBoolean(false);

    public static CancellationSignal none() {
        return new CancellationSignal();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
