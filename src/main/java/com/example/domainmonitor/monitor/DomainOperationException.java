package com.example.domainmonitor.monitor;

import lombok.Getter;

/**
 * A domain operation rejected because of its input or the owner's current state.
 */
@Getter
public class DomainOperationException extends RuntimeException {

    public enum Reason {
        NOT_FOUND, INVALID_NAME, INVALID_INTERVAL, INVALID_REGION, DUPLICATE, LIMIT_REACHED, PERSISTENCE
    }

    private final Reason reason;

    public DomainOperationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }
}
