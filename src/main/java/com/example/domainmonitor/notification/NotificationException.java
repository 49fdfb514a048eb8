package com.example.domainmonitor.notification;

/**
 * A message could not be delivered to a channel.
 */
public class NotificationException extends RuntimeException {

    public NotificationException(String message) {
        super(message);
    }

    public NotificationException(String message, Throwable cause) {
        super(message, cause);
    }
}
