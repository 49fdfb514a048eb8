package com.example.domainmonitor.notification;

/**
 * Rendered notification. Chat channels use {@code text}; email uses subject and html.
 */
public record NotificationMessage(String subject, String text, String html) {
}
