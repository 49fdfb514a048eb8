package com.example.domainmonitor.region;

import java.util.Map;

/**
 * One provider's region data: location identifiers per region code, the region used for
 * unknown codes, and the neighbour appended for regions with sparse checkpoint coverage.
 */
public record RegionTable(String provider,
                          Map<String, String> locations,
                          String defaultRegion,
                          Map<String, String> sparseFallbacks) {

    public RegionTable {
        locations = Map.copyOf(locations);
        sparseFallbacks = Map.copyOf(sparseFallbacks);
        if (!locations.containsKey(defaultRegion)) {
            throw new IllegalArgumentException("Default region " + defaultRegion
                    + " has no location in the " + provider + " table");
        }
    }
}
