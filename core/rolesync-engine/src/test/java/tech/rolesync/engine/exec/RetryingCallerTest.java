package tech.rolesync.engine.exec;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import tech.rolesync.engine.provider.ProviderError;
import tech.rolesync.engine.provider.ProviderException;

import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class RetryingCallerTest {

    private final RetryingCaller caller = new RetryingCaller(RetryPolicy.noDelay(3), null);

    @Test
    @DisplayName("call should return the value on first success")
    void call_shouldReturnValue() {
        // Act
        RetryingCaller.Outcome<String> outcome = caller.call("read", () -> "ok");

        // Assert
        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.value()).isEqualTo("ok");
        assertThat(outcome.attempts()).isEqualTo(1);
    }

    @Test
    @DisplayName("call should retry retryable errors until one succeeds")
    void call_shouldRetryRetryableErrors() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();

        // Act
        RetryingCaller.Outcome<String> outcome = caller.call("read", () -> {
            if (calls.incrementAndGet() < 3) {
                throw new ProviderException(new ProviderError.NetworkError("connection reset"));
            }
            return "ok";
        });

        // Assert
        assertThat(outcome.succeeded()).isTrue();
        assertThat(outcome.attempts()).isEqualTo(3);
    }

    @Test
    @DisplayName("call should give up after max attempts and keep the last failure")
    void call_shouldGiveUp_whenAttemptsExhausted() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();

        // Act
        RetryingCaller.Outcome<String> outcome = caller.call("read", () -> {
            throw new ProviderException(new ProviderError.ServerError(502, "bad gateway " + calls.incrementAndGet()));
        });

        // Assert
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.attempts()).isEqualTo(3);
        assertThat(outcome.failure().getMessage()).isEqualTo("bad gateway 3");
    }

    @Test
    @DisplayName("call should not retry non-retryable errors")
    void call_shouldNotRetry_whenErrorIsPermanent() {
        // Arrange
        AtomicInteger calls = new AtomicInteger();

        // Act
        RetryingCaller.Outcome<String> outcome = caller.call("create", () -> {
            calls.incrementAndGet();
            throw new ProviderException(new ProviderError.Conflict("role.name_in_use"));
        });

        // Assert
        assertThat(outcome.succeeded()).isFalse();
        assertThat(outcome.failure().getError()).isInstanceOf(ProviderError.Conflict.class);
        assertThat(calls).hasValue(1);
    }

    @Test
    @DisplayName("call should pass unexpected runtime exceptions through")
    void call_shouldPropagateUnexpectedExceptions() {
        assertThatThrownBy(() -> caller.call("create", () -> {
            throw new IllegalStateException("bug");
        })).isInstanceOf(IllegalStateException.class);
    }

    @Test
    @DisplayName("call should work under a call-rate limit")
    void call_shouldSucceed_whenRateLimited() {
        // Arrange
        RetryingCaller limited = new RetryingCaller(RetryPolicy.noDelay(1), 600);

        // Act
        RetryingCaller.Outcome<Integer> outcome = limited.call("read", () -> 42);

        // Assert
        assertThat(outcome.value()).isEqualTo(42);
    }
}
