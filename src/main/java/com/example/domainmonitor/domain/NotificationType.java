package com.example.domainmonitor.domain;

/**
 * Kind of notification derived from a status observation. Never stored on the domain.
 */
public enum NotificationType {
    DOWN, UP, STATUS;

    /**
     * DOWN while the domain is unavailable, UP when it is available and the caller saw a
     * transition, STATUS otherwise.
     */
    public static NotificationType of(Domain domain, boolean transitioned) {
        if (!domain.isAvailable()) {
            return DOWN;
        }
        return transitioned ? UP : STATUS;
    }

    public boolean isTransition() {
        return this != STATUS;
    }

    public String code() {
        return name().toLowerCase();
    }
}
