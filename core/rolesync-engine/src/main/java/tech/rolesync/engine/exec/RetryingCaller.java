package tech.rolesync.engine.exec;

import io.github.resilience4j.ratelimiter.RateLimiter;
import io.github.resilience4j.ratelimiter.RateLimiterConfig;
import org.jboss.logging.Logger;
import tech.rolesync.engine.provider.ProviderError;
import tech.rolesync.engine.provider.ProviderException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Runs provider calls under the retry policy and the optional call-rate limit.
 *
 * <p>Retryable {@link ProviderException}s are retried with backoff until the
 * policy is exhausted. Non-retryable ones end the call immediately.
 */
public class RetryingCaller {

    private static final Logger LOG = Logger.getLogger(RetryingCaller.class);

    private final RetryPolicy policy;
    private final RateLimiter rateLimiter;

    /**
     * Result of a call: either a value or the last failure, with the attempts made.
     */
    public record Outcome<T>(T value, ProviderException failure, int attempts) {
        public boolean succeeded() {
            return failure == null;
        }
    }

    /**
     * @param rateLimitPerMinute null or non-positive disables throttling
     */
    public RetryingCaller(RetryPolicy policy, Integer rateLimitPerMinute) {
        this.policy = policy;
        if (rateLimitPerMinute != null && rateLimitPerMinute > 0) {
            LOG.infof("Limiting provider calls to %d/min", rateLimitPerMinute);
            this.rateLimiter = RateLimiter.of(
                "rolesync-provider",
                RateLimiterConfig.custom()
                    .limitRefreshPeriod(Duration.ofMinutes(1))
                    .limitForPeriod(rateLimitPerMinute)
                    .timeoutDuration(Duration.ofSeconds(5))
                    .build()
            );
        } else {
            this.rateLimiter = null;
        }
    }

    public <T> Outcome<T> call(String action, Supplier<T> supplier) {
        int attempt = 0;
        while (true) {
            attempt++;
            awaitPermit();
            try {
                return new Outcome<>(supplier.get(), null, attempt);
            } catch (ProviderException e) {
                ProviderError error = e.getError();
                if (!error.isRetryable() || attempt >= policy.maxAttempts()) {
                    return new Outcome<>(null, e, attempt);
                }

                Duration hint = error instanceof ProviderError.RateLimited rl ? rl.retryAfter() : null;
                Duration delay = policy.delayBefore(attempt, hint);
                LOG.debugf("%s failed with %s (attempt %d/%d), retrying in %d ms",
                    action, error.kind(), attempt, policy.maxAttempts(), delay.toMillis());

                if (!sleep(delay)) {
                    return new Outcome<>(null, e, attempt);
                }
            }
        }
    }

    public RetryPolicy policy() {
        return policy;
    }

    private void awaitPermit() {
        RateLimiter limiter = this.rateLimiter;
        if (limiter == null) {
            return;
        }
        while (!limiter.acquirePermission()) {
            if (Thread.currentThread().isInterrupted()) {
                return;
            }
            LOG.debug("Call rate limit reached, waiting for permit");
        }
    }

    private boolean sleep(Duration delay) {
        if (delay.isZero() || delay.isNegative()) {
            return true;
        }
        try {
            Thread.sleep(delay.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }
}
