package com.invdash.refresh;

/**
 * Thrown when no collector is registered for a provider id.
 */
public class ProviderNotFoundException extends RuntimeException {
    public ProviderNotFoundException(String provider) {
        super("Unknown provider: " + provider);
    }
}
