package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;

/**
 * Per-provider circuit breaker.
 *
 * <p>State bookkeeping is synchronized on the breaker; the protected call itself
 * runs outside the monitor so a slow provider never blocks state inspection.
 * The breaker only sees the final outcome of a call, so when retries are
 * wrapped inside {@link #execute(Supplier)} an exhausted retry loop counts as
 * one failure.</p>
 */
public class CircuitBreaker {
    private static final Logger log = LoggerFactory.getLogger(CircuitBreaker.class);

    private final Provider provider;
    private final CircuitBreakerConfig config;
    private final Clock clock;
    private final List<CircuitStateListener> listeners = new CopyOnWriteArrayList<>();

    private CircuitState state = CircuitState.CLOSED;
    private int failureCount;
    private int successCount;
    private Instant nextRetryAt;

    public CircuitBreaker(Provider provider) {
        this(provider, CircuitBreakerConfig.defaults(), Clock.systemUTC());
    }

    public CircuitBreaker(Provider provider, CircuitBreakerConfig config, Clock clock) {
        this.provider = provider;
        this.config = config;
        this.clock = clock;
    }

    public void addListener(CircuitStateListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    /**
     * Runs {@code fn} if the circuit admits it and records the outcome.
     * Failures from {@code fn} are rethrown unchanged.
     *
     * @throws CircuitOpenException if the circuit is open and the cooldown has not elapsed
     */
    public <T> T execute(Supplier<T> fn) {
        admit();
        T result;
        try {
            result = fn.get();
        } catch (RuntimeException e) {
            onFailure(e);
            throw e;
        }
        onSuccess();
        return result;
    }

    private void admit() {
        CircuitState previous;
        int failures;
        synchronized (this) {
            if (state != CircuitState.OPEN) {
                return;
            }
            if (clock.instant().isBefore(nextRetryAt)) {
                throw new CircuitOpenException(provider, failureCount, nextRetryAt);
            }
            previous = state;
            state = CircuitState.HALF_OPEN;
            successCount = 0;
            failures = failureCount;
        }
        log.info("circuitBreaker.halfOpen provider={} failureCount={}", provider.key(), failures);
        notifyListeners(previous, CircuitState.HALF_OPEN);
    }

    private void onSuccess() {
        CircuitState previous;
        synchronized (this) {
            if (state == CircuitState.CLOSED) {
                failureCount = 0;
                return;
            }
            if (state != CircuitState.HALF_OPEN) {
                return;
            }
            successCount++;
            if (successCount < config.successThreshold()) {
                return;
            }
            previous = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            nextRetryAt = null;
        }
        log.info("circuitBreaker.closed provider={}", provider.key());
        notifyListeners(previous, CircuitState.CLOSED);
    }

    private void onFailure(RuntimeException cause) {
        CircuitState previous;
        int failures;
        Instant retryAt;
        synchronized (this) {
            failureCount++;
            successCount = 0;
            boolean trip = state == CircuitState.HALF_OPEN
                    || (state == CircuitState.CLOSED && failureCount >= config.failureThreshold());
            if (!trip) {
                return;
            }
            previous = state;
            state = CircuitState.OPEN;
            nextRetryAt = clock.instant().plus(config.cooldown());
            failures = failureCount;
            retryAt = nextRetryAt;
        }
        log.warn("circuitBreaker.opened provider={} failureCount={} nextRetryAt={} cause={}",
                provider.key(), failures, retryAt, cause.getMessage());
        notifyListeners(previous, CircuitState.OPEN);
    }

    private void notifyListeners(CircuitState from, CircuitState to) {
        for (CircuitStateListener listener : listeners) {
            try {
                listener.onStateChange(provider, from, to);
            } catch (RuntimeException e) {
                log.warn("circuitBreaker.listenerFailed provider={} listener={}",
                        provider.key(), listener.getClass().getSimpleName(), e);
            }
        }
    }

    public synchronized CircuitState getState() {
        return state;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * When the circuit may next admit a trial call; {@code null} unless open or half-open.
     */
    public synchronized Instant getNextRetryAt() {
        return nextRetryAt;
    }

    /**
     * Forces the circuit back to CLOSED and clears all counters.
     */
    public void reset() {
        CircuitState previous;
        synchronized (this) {
            previous = state;
            state = CircuitState.CLOSED;
            failureCount = 0;
            successCount = 0;
            nextRetryAt = null;
        }
        if (previous != CircuitState.CLOSED) {
            log.info("circuitBreaker.reset provider={} from={}", provider.key(), previous);
            notifyListeners(previous, CircuitState.CLOSED);
        }
    }
}
