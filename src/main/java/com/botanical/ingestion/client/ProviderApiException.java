package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * The provider answered with a non-2xx HTTP status.
 */
public class ProviderApiException extends ProviderException {

    private final int statusCode;

    public ProviderApiException(Provider provider, int statusCode, String message) {
        super(provider, message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRateLimited() {
        return statusCode == 429;
    }

    public boolean isServerError() {
        return statusCode >= 500;
    }

    /**
     * Rate limiting and server errors are transient; other statuses are not.
     */
    public boolean isRetryable() {
        return isRateLimited() || isServerError();
    }
}
