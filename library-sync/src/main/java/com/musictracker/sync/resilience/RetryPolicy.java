package com.musictracker.sync.resilience;

import com.musictracker.sync.config.LibrarySyncProperties;
import com.musictracker.sync.exception.CircuitOpenException;
import com.musictracker.sync.exception.ProviderException;
import com.musictracker.sync.exception.RateLimitedException;
import com.musictracker.sync.exception.RetryableProviderException;
import com.musictracker.sync.exception.TerminalProviderException;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Bounded exponential-backoff retry around calls to one dependency.
 *
 * Each attempt first asks the dependency's {@link CircuitBreaker}; an open breaker
 * fails fast with {@link CircuitOpenException} and ends the call without further attempts.
 * Only {@link RetryableProviderException} (timeouts, connection failures, 5xx) is retried.
 * The delay before attempt n+1 is {@code min(initialDelay * multiplier^(n-1), maxDelay)}.
 */
@Slf4j
public class RetryPolicy {

    private final CircuitBreaker circuitBreaker;
    private final Retry retry;

    public RetryPolicy(CircuitBreaker circuitBreaker, LibrarySyncProperties.Resilience.Retry settings) {
        this(circuitBreaker, settings.getMaxAttempts(), settings.getInitialDelay(),
                settings.getMaxDelay(), settings.getBackoffMultiplier());
    }

    public RetryPolicy(CircuitBreaker circuitBreaker, int maxAttempts, Duration initialDelay,
                       Duration maxDelay, double backoffMultiplier) {
        this.circuitBreaker = circuitBreaker;

        RetryConfig config = RetryConfig.custom()
                .maxAttempts(maxAttempts)
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        initialDelay.toMillis(), backoffMultiplier, maxDelay.toMillis()))
                .retryOnException(RetryPolicy::isRetryable)
                .build();

        this.retry = Retry.of(circuitBreaker.getName(), config);
        this.retry.getEventPublisher()
                .onRetry(event -> log.warn("{} call attempt #{} failed, retrying in {}ms: {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getWaitInterval().toMillis(),
                        event.getLastThrowable().getMessage()))
                .onError(event -> log.error("{} call failed after {} attempts: {}",
                        event.getName(),
                        event.getNumberOfRetryAttempts(),
                        event.getLastThrowable().getMessage()));
    }

    /**
     * Run {@code call} under the breaker and the retry budget.
     *
     * @param operation short description used in logs
     * @throws ProviderException the last failure once attempts are exhausted, or immediately
     *                           for terminal, rate-limit and open-circuit failures
     */
    public <T> T execute(String operation, Supplier<T> call) {
        Supplier<T> guarded = () -> {
            if (!circuitBreaker.allow()) {
                throw new CircuitOpenException(circuitBreaker.getName(), circuitBreaker.remainingOpenTime());
            }
            try {
                T result = call.get();
                circuitBreaker.recordSuccess();
                return result;
            } catch (TerminalProviderException | RateLimitedException e) {
                // the dependency answered; it is not unhealthy
                throw e;
            } catch (RuntimeException e) {
                circuitBreaker.recordFailure();
                throw e;
            }
        };
        log.debug("{}: {}", circuitBreaker.getName(), operation);
        return Retry.decorateSupplier(retry, guarded).get();
    }

    /** Exposes resilience4j retry events, mainly for tests and metrics. */
    public Retry.EventPublisher getEventPublisher() {
        return retry.getEventPublisher();
    }

    public CircuitBreaker getCircuitBreaker() {
        return circuitBreaker;
    }

    static boolean isRetryable(Throwable error) {
        return error instanceof RetryableProviderException;
    }
}
