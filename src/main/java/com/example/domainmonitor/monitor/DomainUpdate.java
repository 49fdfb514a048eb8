package com.example.domainmonitor.monitor;

/**
 * Partial update of a domain's settings; null fields are left unchanged.
 */
public record DomainUpdate(Boolean active, Integer interval, String region) {
}
