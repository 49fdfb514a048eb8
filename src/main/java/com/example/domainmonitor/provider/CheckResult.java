package com.example.domainmonitor.provider;

import java.time.Instant;

/**
 * A single provider check of a monitored URL.
 */
public record CheckResult(int statusCode,
                          int totalTimeMs,
                          int errorCode,
                          String errorDescription,
                          boolean available,
                          Instant checkedAt) {
}
