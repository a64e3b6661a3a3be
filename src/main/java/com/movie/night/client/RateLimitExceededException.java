package com.movie.night.client;

/**
 * Thrown by a provider client when the remote service refuses further calls for now.
 * Enrichment propagates it so batch jobs can stop and resume later.
 */
public class RateLimitExceededException extends RuntimeException {

    private final String provider;

    public RateLimitExceededException(String provider, String message) {
        super(message);
        this.provider = provider;
    }

    public RateLimitExceededException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
