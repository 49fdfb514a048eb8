package com.example.domainmonitor.provider.uptrends;

import com.example.domainmonitor.provider.AbstractProviderClient;
import com.example.domainmonitor.provider.CheckResult;
import com.example.domainmonitor.provider.CheckTimestamps;
import com.example.domainmonitor.provider.ProviderException;
import com.example.domainmonitor.provider.TickRateLimiter;
import com.example.domainmonitor.region.RegionResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Credentials;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Uptrends API v4 client.
 *
 * Monitors are HTTPS monitors checking from the checkpoint regions of the domain's region
 * and its fallbacks. Check results come from all of those checkpoints, so the latest check
 * is filtered down to the checkpoints of the requested region.
 */
@Slf4j
public class UptrendsClient extends AbstractProviderClient {

    public static final String NAME = "uptrends";

    private static final int RECENT_CHECKS = 10;
    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'"),
            DateTimeFormatter.ISO_OFFSET_DATE_TIME);

    private final String baseUrl;
    private final String authorization;
    private final Clock clock;

    public UptrendsClient(String baseUrl, String username, String apiKey,
                          OkHttpClient httpClient, ObjectMapper objectMapper,
                          TickRateLimiter rateLimiter, RegionResolver regions,
                          MeterRegistry meterRegistry, Clock clock) {
        super(NAME, httpClient, objectMapper, rateLimiter, regions, meterRegistry);
        this.baseUrl = stripTrailingSlash(baseUrl);
        this.authorization = Credentials.basic(username, apiKey);
        this.clock = clock;
    }

    @Override
    public String createMonitor(String url, String displayName, List<String> regionCodes) {
        List<Integer> regionIds = regionCodes.stream()
                .map(regions()::locationId)
                .distinct()
                .map(Integer::valueOf)
                .toList();

        Map<String, Object> checkpoints = new LinkedHashMap<>();
        checkpoints.put("Checkpoints", List.of());
        checkpoints.put("Regions", regionIds);
        checkpoints.put("ExcludeLocations", List.of());

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("MonitorType", "Https");
        payload.put("Url", withScheme(url));
        payload.put("SelectedCheckpoints", checkpoints);
        payload.put("UsePrimaryCheckpointsOnly", false);
        payload.put("Name", displayName);

        Request request = authorized(baseUrl + "/Monitor")
                .post(jsonBody("create", payload))
                .build();
        JsonNode response = readJson("create", execute("create", displayName, request, 200, 201));

        String guid = response.path("MonitorGuid").asText("");
        if (guid.isBlank()) {
            throw new ProviderException(NAME, "create", 0, "Response carried no MonitorGuid for " + displayName);
        }
        log.info("[uptrends] Created monitor {} for {} in regions {}", guid, url, regionCodes);
        return guid;
    }

    @Override
    public void updateMonitorStatus(String externalId, boolean active) {
        Request request = authorized(baseUrl + "/Monitor/" + externalId)
                .patch(jsonBody("update", Map.of("IsActive", active)))
                .build();
        execute("update", externalId, request, 200, 204);
        log.info("[uptrends] Monitor {} set active={}", externalId, active);
    }

    @Override
    public void deleteMonitor(String externalId) {
        Request request = authorized(baseUrl + "/Monitor/" + externalId)
                .delete()
                .build();
        execute("delete", externalId, request, 200, 204);
        log.info("[uptrends] Deleted monitor {}", externalId);
    }

    @Override
    public Optional<CheckResult> getLatestCheck(String externalId, String region) {
        Set<Integer> checkpointIds = checkpointIds(region);

        HttpUrl url = HttpUrl.get(baseUrl + "/MonitorCheck/Monitor/" + externalId).newBuilder()
                .addQueryParameter("Sorting", "Descending")
                .addQueryParameter("Take", String.valueOf(RECENT_CHECKS))
                .addQueryParameter("PresetPeriod", "Last2Hours")
                .build();
        Request request = authorized(url.toString()).get().build();
        JsonNode response = readJson("check", execute("check", externalId, request, 200));

        JsonNode data = response.path("Data");
        if (!data.isArray() || data.isEmpty()) {
            throw new ProviderException(NAME, "check", 0, "No check data for monitor " + externalId);
        }

        for (JsonNode check : data) {
            JsonNode attributes = check.path("Attributes");
            // server ids are checkpoint id * 10 + server index
            int checkpointId = attributes.path("ServerId").asInt() / 10;
            if (checkpointIds.isEmpty() || checkpointIds.contains(checkpointId)) {
                return Optional.of(toCheckResult(attributes, externalId));
            }
        }
        log.debug("[uptrends] No check of monitor {} came from region {}", externalId, region);
        return Optional.empty();
    }

    /**
     * Checkpoint ids of a region. An empty set disables filtering.
     */
    Set<Integer> checkpointIds(String region) {
        String regionId = regions().locationId(region);
        try {
            Request request = authorized(baseUrl + "/CheckpointRegion/" + regionId + "/Checkpoint").get().build();
            JsonNode response = readJson("checkpoints", execute("checkpoints", regionId, request, 200));
            Set<Integer> ids = new HashSet<>();
            for (JsonNode checkpoint : response) {
                ids.add(checkpoint.path("CheckpointId").asInt());
            }
            return ids;
        } catch (ProviderException e) {
            log.warn("[uptrends] Checkpoint lookup for region {} failed, results are not filtered: {}",
                    region, e.getMessage());
            return Set.of();
        }
    }

    private CheckResult toCheckResult(JsonNode attributes, String externalId) {
        String errorLevel = attributes.path("ErrorLevel").asText("");
        boolean available = "NoError".equals(errorLevel) || "Warning".equals(errorLevel);
        String timestamp = attributes.path("Timestamp").asText(null);
        Instant checkedAt = CheckTimestamps.parse(timestamp, TIMESTAMP_FORMATS, ZoneOffset.UTC)
                .orElseGet(() -> {
                    log.warn("[uptrends] Unparseable timestamp '{}' on monitor {}, using current time",
                            timestamp, externalId);
                    return clock.instant();
                });
        return new CheckResult(
                attributes.path("HttpStatusCode").asInt(),
                (int) Math.round(attributes.path("TotalTime").asDouble()),
                attributes.path("ErrorCode").asInt(),
                attributes.path("ErrorDescription").asText(""),
                available,
                checkedAt);
    }

    private Request.Builder authorized(String url) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", authorization)
                .header("Accept", "application/json");
    }

    static String withScheme(String url) {
        if (url.startsWith("http://") || url.startsWith("https://")) {
            return url;
        }
        return "https://" + url;
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
