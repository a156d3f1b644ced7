package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;
import com.botanical.ingestion.metrics.MetricsService;
import com.botanical.ingestion.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.function.Supplier;

/**
 * Runs a call with bounded retries and exponential backoff.
 *
 * <p>Non-retryable failures and the failure of the last permitted attempt are
 * rethrown unchanged, without a further delay.</p>
 */
public class RetryExecutor {
    private static final Logger log = LoggerFactory.getLogger(RetryExecutor.class);

    private final Provider provider;
    private final RetryConfig config;
    private final ErrorClassifier classifier;
    private final StatsTracker stats;
    private final Sleeper sleeper;
    private final MetricsService metrics;

    public RetryExecutor(Provider provider, RetryConfig config, ErrorClassifier classifier, StatsTracker stats) {
        this(provider, config, classifier, stats, Sleeper.system(), new NoOpMetricsService());
    }

    public RetryExecutor(Provider provider, RetryConfig config, ErrorClassifier classifier,
                         StatsTracker stats, Sleeper sleeper, MetricsService metrics) {
        this.provider = provider;
        this.config = config;
        this.classifier = classifier;
        this.stats = stats;
        this.sleeper = sleeper;
        this.metrics = metrics;
    }

    public <T> T runWithRetry(Supplier<T> fn) {
        for (int attempt = 0; ; attempt++) {
            try {
                return fn.get();
            } catch (RuntimeException e) {
                ErrorClassification classification = classifier.classify(e);
                if (!classification.retryable() || attempt >= config.maxRetries()) {
                    throw e;
                }
                Duration delay = classification.waitHint() != null ? classification.waitHint() : backoff(attempt);
                stats.recordRetry(attempt == 0);
                metrics.incrementRetry(provider, classification.category());
                log.warn("provider.retrying provider={} category={} attempt={}/{} delayMs={} error={}",
                        provider.key(), classification.category(), attempt + 1, config.maxRetries(),
                        delay.toMillis(), e.getMessage());
                pause(delay);
            }
        }
    }

    /**
     * {@code baseDelay * 2^attempt} plus a random jitter below {@code maxJitter}.
     */
    Duration backoff(int attempt) {
        long exponential = config.baseDelay().toMillis() * (1L << Math.min(attempt, 30));
        long jitterBound = config.maxJitter().toMillis();
        long jitter = jitterBound > 0 ? ThreadLocalRandom.current().nextLong(jitterBound) : 0;
        return Duration.ofMillis(exponential + jitter);
    }

    private void pause(Duration delay) {
        try {
            sleeper.sleep(delay);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderInterruptedException(provider, "Interrupted during retry backoff", e);
        }
    }
}
