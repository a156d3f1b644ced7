package com.botanical.ingestion.client;

import com.botanical.ingestion.core.model.Provider;

/**
 * The client cannot make requests as configured, typically because no API credential is set.
 */
public class ProviderConfigurationException extends ProviderException {

    public ProviderConfigurationException(Provider provider, String message) {
        super(provider, message);
    }
}
