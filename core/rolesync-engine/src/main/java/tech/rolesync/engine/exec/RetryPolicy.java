package tech.rolesync.engine.exec;

import tech.rolesync.engine.config.EngineConfig;

import java.time.Duration;

/**
 * Bounded exponential backoff for transient provider failures.
 */
public record RetryPolicy(
    int maxAttempts,
    Duration initialDelay,
    double multiplier,
    Duration maxDelay
) {

    public RetryPolicy {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be at least 1");
        }
    }

    public static RetryPolicy defaults() {
        return new RetryPolicy(3, Duration.ofMillis(200), 2.0, Duration.ofSeconds(5));
    }

    public static RetryPolicy noDelay(int maxAttempts) {
        return new RetryPolicy(maxAttempts, Duration.ZERO, 1.0, Duration.ZERO);
    }

    public static RetryPolicy from(EngineConfig.RetryConfig config) {
        return new RetryPolicy(
            config.maxAttempts(),
            Duration.ofMillis(config.initialDelayMs()),
            config.multiplier(),
            Duration.ofMillis(config.maxDelayMs())
        );
    }

    /**
     * Delay before the given retry (1 = first retry), honouring a longer server hint.
     * Both are capped at {@code maxDelay}.
     */
    public Duration delayBefore(int retry, Duration serverHint) {
        double millis = initialDelay.toMillis() * Math.pow(multiplier, Math.max(0, retry - 1));
        Duration backoff = Duration.ofMillis((long) Math.min(millis, maxDelay.toMillis()));
        if (serverHint != null && serverHint.compareTo(backoff) > 0) {
            return serverHint.compareTo(maxDelay) > 0 ? maxDelay : serverHint;
        }
        return backoff;
    }
}
