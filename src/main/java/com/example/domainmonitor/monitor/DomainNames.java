package com.example.domainmonitor.monitor;

import java.net.URI;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Host name extraction, validation and duplicate keys for user-entered domains.
 * Input may be a bare host ("example.com") or an http(s) URL.
 */
final class DomainNames {

    private static final Pattern HOST_PATTERN =
            Pattern.compile("^([a-zA-Z0-9]([a-zA-Z0-9\\-]{0,61}[a-zA-Z0-9])?\\.)+[a-zA-Z]{2,}$");

    private DomainNames() {
    }

    static boolean hasScheme(String input) {
        String lower = input.trim().toLowerCase(Locale.ROOT);
        return lower.startsWith("http://") || lower.startsWith("https://");
    }

    static String hostname(String input) {
        String trimmed = input == null ? "" : input.trim();
        if (hasScheme(trimmed)) {
            try {
                String host = URI.create(trimmed).getHost();
                if (host != null) {
                    trimmed = host;
                }
            } catch (IllegalArgumentException e) {
                // left as entered, validation rejects it
            }
        }
        return trimmed.endsWith(".") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    }

    static boolean isValid(String hostname) {
        return hostname.length() >= 3 && hostname.length() <= 253 && HOST_PATTERN.matcher(hostname).matches();
    }

    /** Case-insensitive (hostname, region) identity. */
    static String key(String hostname, String region) {
        return hostname.toLowerCase(Locale.ROOT) + ":" + region;
    }

    static String url(String input, String hostname) {
        return hasScheme(input) ? input.trim() : "https://" + hostname;
    }
}
