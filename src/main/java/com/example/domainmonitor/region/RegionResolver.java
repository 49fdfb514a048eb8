package com.example.domainmonitor.region;

import java.util.List;

/**
 * Maps a logical region code to a provider location and its fallback regions.
 * Unknown codes resolve to the table's default region instead of failing: checking from
 * the wrong region is preferred over not checking at all.
 */
public class RegionResolver {

    private final RegionTable table;

    public RegionResolver(RegionTable table) {
        this.table = table;
    }

    public ResolvedRegion resolve(String region) {
        String code = RegionTables.canonicalCode(region)
                .filter(table.locations()::containsKey)
                .orElse(table.defaultRegion());
        String fallback = table.sparseFallbacks().get(code);
        return new ResolvedRegion(code, table.locations().get(code),
                fallback != null ? List.of(fallback) : List.of());
    }

    /** Location id for a region, resolving unknown codes to the default. */
    public String locationId(String region) {
        return resolve(region).locationId();
    }

    public String provider() {
        return table.provider();
    }
}
