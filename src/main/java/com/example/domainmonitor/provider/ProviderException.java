package com.example.domainmonitor.provider;

import lombok.Getter;

/**
 * Failure of a remote provider operation: transport error, non-success HTTP status or an
 * unusable response body.
 */
@Getter
public class ProviderException extends RuntimeException {

    private final String provider;
    private final String operation;
    /** HTTP status of the failed call, 0 when no response was received */
    private final int statusCode;

    public ProviderException(String provider, String operation, int statusCode, String message) {
        super(message);
        this.provider = provider;
        this.operation = operation;
        this.statusCode = statusCode;
    }

    public ProviderException(String provider, String operation, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
        this.operation = operation;
        this.statusCode = 0;
    }
}
