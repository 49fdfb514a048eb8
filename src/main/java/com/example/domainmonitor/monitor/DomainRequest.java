package com.example.domainmonitor.monitor;

/**
 * A domain to add. A null interval means the configured default.
 */
public record DomainRequest(String name, String region, Integer interval) {

    public DomainRequest(String name, String region) {
        this(name, region, null);
    }
}
