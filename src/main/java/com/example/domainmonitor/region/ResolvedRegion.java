package com.example.domainmonitor.region;

import java.util.ArrayList;
import java.util.List;

/**
 * Result of resolving a logical region for one provider.
 *
 * @param region         canonical region code actually used (the default for unknown input)
 * @param locationId     provider-specific location identifier
 * @param fallbackRegions neighbouring regions added for sparse coverage
 */
public record ResolvedRegion(String region, String locationId, List<String> fallbackRegions) {

    public ResolvedRegion {
        fallbackRegions = List.copyOf(fallbackRegions);
    }

    /** Primary region followed by its fallbacks. */
    public List<String> submittedRegions() {
        List<String> regions = new ArrayList<>(1 + fallbackRegions.size());
        regions.add(region);
        regions.addAll(fallbackRegions);
        return List.copyOf(regions);
    }
}
