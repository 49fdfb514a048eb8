package com.example.domainmonitor.region;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Static region data. Providers disagree on which regions are thinly covered and on the
 * neighbour to add, so each provider carries its own fallback table.
 */
public final class RegionTables {

    /** Supported region codes with their English names, in display order */
    public static final Map<String, String> SUPPORTED_REGIONS;

    static {
        Map<String, String> regions = new LinkedHashMap<>();
        regions.put("CN", "China");
        regions.put("VN", "Vietnam");
        regions.put("ID", "Indonesia");
        regions.put("IN", "India");
        regions.put("TH", "Thailand");
        regions.put("JP", "Japan");
        regions.put("KR", "Korea");
        SUPPORTED_REGIONS = Collections.unmodifiableMap(regions);
    }

    public static final RegionTable UPTRENDS = new RegionTable(
            "uptrends",
            Map.of(
                    "CN", "45",
                    "IN", "101",
                    "JP", "109",
                    "KR", "117",
                    "TH", "248",
                    "ID", "251",
                    "VN", "255"),
            "CN",
            Map.of(
                    "TH", "VN",
                    "VN", "TH",
                    "KR", "JP"));

    public static final RegionTable SITE24X7 = new RegionTable(
            "site24x7",
            Map.of(
                    "CN", "567462000000029011",
                    "ID", "567462000000029013",
                    "IN", "567462000000029015",
                    "JP", "567462000000029017",
                    "TH", "567462000000029019",
                    "VN", "567462000000029021",
                    "KR", "567462000000029023"),
            "CN",
            // a Site24x7 monitor checks from a single location profile
            Map.of());

    private RegionTables() {
    }

    public static Set<String> supportedCodes() {
        return SUPPORTED_REGIONS.keySet();
    }

    public static boolean isSupported(String region) {
        return canonicalCode(region).isPresent();
    }

    /**
     * Accepts a region code or its English name, case-insensitively.
     */
    public static Optional<String> canonicalCode(String region) {
        if (region == null || region.isBlank()) {
            return Optional.empty();
        }
        String trimmed = region.trim();
        String upper = trimmed.toUpperCase(Locale.ROOT);
        if (SUPPORTED_REGIONS.containsKey(upper)) {
            return Optional.of(upper);
        }
        return SUPPORTED_REGIONS.entrySet().stream()
                .filter(e -> e.getValue().equalsIgnoreCase(trimmed))
                .map(Map.Entry::getKey)
                .findFirst();
    }
}
