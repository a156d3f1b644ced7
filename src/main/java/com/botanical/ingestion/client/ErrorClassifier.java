package com.botanical.ingestion.client;

import java.time.Duration;

/**
 * Maps a failure to a retry decision. Pure; holds only the rate-limit wait.
 *
 * <ul>
 *   <li>timeouts, network failures, 5xx and unknown failures are retried with backoff</li>
 *   <li>429 is retried after a fixed wait</li>
 *   <li>other 4xx, open circuits and configuration problems are not retried</li>
 * </ul>
 */
public class ErrorClassifier {

    public static final Duration DEFAULT_RATE_LIMIT_WAIT = Duration.ofSeconds(60);

    private final Duration rateLimitWait;

    public ErrorClassifier() {
        this(DEFAULT_RATE_LIMIT_WAIT);
    }

    public ErrorClassifier(Duration rateLimitWait) {
        this.rateLimitWait = rateLimitWait;
    }

    public ErrorClassification classify(Throwable error) {
        if (error instanceof ProviderTimeoutException) {
            return ErrorClassification.retryable(ErrorCategory.TIMEOUT);
        }
        if (error instanceof ProviderNetworkException) {
            return ErrorClassification.retryable(ErrorCategory.NETWORK);
        }
        if (error instanceof ProviderApiException api) {
            if (api.isRateLimited()) {
                return ErrorClassification.retryableAfter(ErrorCategory.RATE_LIMIT, rateLimitWait);
            }
            if (api.isServerError()) {
                return ErrorClassification.retryable(ErrorCategory.SERVER_ERROR);
            }
            return ErrorClassification.fatal(ErrorCategory.CLIENT_ERROR);
        }
        if (error instanceof CircuitOpenException) {
            return ErrorClassification.fatal(ErrorCategory.CIRCUIT_BREAKER);
        }
        if (error instanceof ProviderRequestException) {
            return ErrorClassification.fatal(ErrorCategory.CLIENT_ERROR);
        }
        if (error instanceof ProviderConfigurationException) {
            return ErrorClassification.fatal(ErrorCategory.CONFIGURATION);
        }
        if (error instanceof ProviderInterruptedException) {
            return ErrorClassification.fatal(ErrorCategory.UNKNOWN);
        }
        return ErrorClassification.retryable(ErrorCategory.UNKNOWN);
    }
}
