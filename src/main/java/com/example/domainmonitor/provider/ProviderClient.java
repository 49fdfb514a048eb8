package com.example.domainmonitor.provider;

import com.example.domainmonitor.region.RegionResolver;

import java.util.List;
import java.util.Optional;

/**
 * One external uptime provider. Every call waits for the provider's rate limiter before
 * going out and fails with {@link ProviderException}; nothing is retried here.
 */
public interface ProviderClient {

    /** Stable provider name stored on registrations, e.g. "uptrends". */
    String name();

    /** Region data used to build the region list submitted on creation. */
    RegionResolver regions();

    /**
     * Creates a remote monitor and returns the provider-assigned identifier.
     *
     * @param regions primary region followed by fallbacks
     */
    String createMonitor(String url, String displayName, List<String> regions);

    void updateMonitorStatus(String externalId, boolean active);

    void deleteMonitor(String externalId);

    /**
     * Latest check for the monitor as seen from the given region. Empty when the provider
     * returned checks but none came from that region's checkpoints.
     */
    Optional<CheckResult> getLatestCheck(String externalId, String region);
}
