package com.example.domainmonitor.provider.site24x7;

import com.example.domainmonitor.provider.AbstractProviderClient;
import com.example.domainmonitor.provider.AccessTokenCache;
import com.example.domainmonitor.provider.CheckResult;
import com.example.domainmonitor.provider.CheckTimestamps;
import com.example.domainmonitor.provider.ProviderException;
import com.example.domainmonitor.provider.TickRateLimiter;
import com.example.domainmonitor.region.RegionResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.FormBody;
import okhttp3.HttpUrl;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Site24x7 API client authenticated with a Zoho OAuth refresh token.
 *
 * Each monitor checks from a single location profile, so the latest log report entry is
 * already the requested region's result.
 */
@Slf4j
public class Site24x7Client extends AbstractProviderClient {

    public static final String NAME = "site24x7";

    static final String ACCEPT_V21 = "application/json; version=2.1";
    static final String ACCEPT_V20 = "application/json; version=2.0";
    static final ZoneId REPORT_ZONE = ZoneId.of("Asia/Shanghai");
    static final DateTimeFormatter REPORT_WINDOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ssZ");

    private static final Duration REPORT_WINDOW = Duration.ofMinutes(15);
    private static final Duration TOKEN_EXPIRY_MARGIN = Duration.ofMinutes(10);
    private static final List<DateTimeFormatter> TIMESTAMP_FORMATS = List.of(
            REPORT_WINDOW_FORMAT,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME,
            DateTimeFormatter.ISO_LOCAL_DATE_TIME);

    private final String baseUrl;
    private final Profiles profiles;
    private final AccessTokenCache tokens;
    private final Clock clock;

    /**
     * Alerting profiles attached to every created monitor.
     */
    public record Profiles(String notificationProfileId, String thresholdProfileId, String userGroupId) {
    }

    /**
     * Zoho OAuth client credentials.
     */
    public record OAuthCredentials(String tokenUrl, String clientId, String clientSecret, String refreshToken) {
    }

    public Site24x7Client(String baseUrl, OAuthCredentials credentials, Profiles profiles,
                          OkHttpClient httpClient, ObjectMapper objectMapper,
                          TickRateLimiter rateLimiter, RegionResolver regions,
                          MeterRegistry meterRegistry, Clock clock) {
        super(NAME, httpClient, objectMapper, rateLimiter, regions, meterRegistry);
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.profiles = profiles;
        this.clock = clock;
        this.tokens = new AccessTokenCache(NAME, () -> refreshToken(credentials), clock);
    }

    @Override
    public String createMonitor(String url, String displayName, List<String> regionCodes) {
        String primary = regionCodes.isEmpty() ? null : regionCodes.get(0);

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("display_name", "Monitor - " + displayName);
        payload.put("type", "URL");
        payload.put("website", url);
        payload.put("check_frequency", "5");
        payload.put("timeout", 15);
        payload.put("http_method", "G");
        payload.put("location_profile_id", regions().locationId(primary));
        payload.put("notification_profile_id", profiles.notificationProfileId());
        payload.put("threshold_profile_id", profiles.thresholdProfileId());
        payload.put("user_group_ids", List.of(profiles.userGroupId()));
        payload.put("use_ipv6", false);
        payload.put("match_case", false);
        payload.put("user_agent", "Mozilla Firefox");
        payload.put("use_name_server", false);

        Request request = authorized(baseUrl + "/monitors", ACCEPT_V21)
                .post(jsonBody("create", payload))
                .build();
        JsonNode response = checkCode("create", displayName,
                readJson("create", execute("create", displayName, request, 200, 201)));

        String monitorId = response.path("data").path("monitor_id").asText("");
        if (monitorId.isBlank()) {
            throw new ProviderException(NAME, "create", 0, "Response carried no monitor_id for " + displayName);
        }
        log.info("[site24x7] Created monitor {} for {} in region {}", monitorId, url, primary);
        return monitorId;
    }

    @Override
    public void updateMonitorStatus(String externalId, boolean active) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("monitor_id", externalId);
        payload.put("suspend_alert", !active);

        Request request = authorized(baseUrl + "/monitors/" + externalId, ACCEPT_V21)
                .put(jsonBody("update", payload))
                .build();
        checkCode("update", externalId, readJson("update", execute("update", externalId, request, 200, 201)));
        log.info("[site24x7] Monitor {} set active={}", externalId, active);
    }

    @Override
    public void deleteMonitor(String externalId) {
        Request request = authorized(baseUrl + "/monitors/" + externalId, ACCEPT_V21)
                .delete()
                .build();
        execute("delete", externalId, request, 200, 201, 204);
        log.info("[site24x7] Deleted monitor {}", externalId);
    }

    @Override
    public Optional<CheckResult> getLatestCheck(String externalId, String region) {
        Instant end = clock.instant();
        Instant start = end.minus(REPORT_WINDOW);
        HttpUrl url = HttpUrl.get(baseUrl + "/reports/log_reports/" + externalId).newBuilder()
                .addQueryParameter("start_date", REPORT_WINDOW_FORMAT.format(start.atZone(REPORT_ZONE)))
                .addQueryParameter("end_date", REPORT_WINDOW_FORMAT.format(end.atZone(REPORT_ZONE)))
                .build();
        Request request = authorized(url.toString(), ACCEPT_V20).get().build();
        JsonNode response = checkCode("check", externalId,
                readJson("check", execute("check", externalId, request, 200)));

        JsonNode report = response.path("data").path("report");
        if (!report.isArray() || report.isEmpty()) {
            throw new ProviderException(NAME, "check", 0, "No log report entries for monitor " + externalId);
        }
        return Optional.of(toCheckResult(report.get(0), externalId));
    }

    public AccessTokenCache.State tokenState() {
        return tokens.getState();
    }

    private CheckResult toCheckResult(JsonNode entry, String externalId) {
        String collectionTime = entry.path("collection_time").asText(null);
        Instant checkedAt = CheckTimestamps.parse(collectionTime, TIMESTAMP_FORMATS, REPORT_ZONE)
                .orElseGet(() -> {
                    log.warn("[site24x7] Unparseable collection time '{}' on monitor {}, using current time",
                            collectionTime, externalId);
                    return clock.instant();
                });
        boolean available = "1".equals(entry.path("availability").asText());
        return new CheckResult(
                parseNumber(entry.path("response_code").asText()),
                parseNumber(entry.path("response_time").asText()),
                0,
                entry.path("reason").asText(""),
                available,
                checkedAt);
    }

    private JsonNode checkCode(String operation, String identifier, JsonNode response) {
        int code = response.path("code").asInt(0);
        if (code != 0) {
            throw new ProviderException(NAME, operation, 0, String.format("%s for %s rejected with code %d: %s",
                    operation, identifier, code, response.path("message").asText("")));
        }
        return response;
    }

    private Request.Builder authorized(String url, String accept) {
        return new Request.Builder()
                .url(url)
                .header("Authorization", "Zoho-oauthtoken " + tokens.getToken())
                .header("Accept", accept);
    }

    private AccessTokenCache.TokenInfo refreshToken(OAuthCredentials credentials) {
        FormBody form = new FormBody.Builder()
                .add("client_id", credentials.clientId())
                .add("client_secret", credentials.clientSecret())
                .add("refresh_token", credentials.refreshToken())
                .add("grant_type", "refresh_token")
                .build();
        Request request = new Request.Builder().url(credentials.tokenUrl()).post(form).build();

        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!response.isSuccessful()) {
                throw new ProviderException(NAME, "token", response.code(), "Token refresh returned HTTP " + response.code());
            }
            JsonNode json = readJson("token", body);
            String accessToken = json.path("access_token").asText("");
            if (accessToken.isBlank()) {
                throw new ProviderException(NAME, "token", response.code(),
                        "Token refresh returned no access token: " + json.path("error").asText(""));
            }
            long expiresIn = json.path("expires_in").asLong(3600);
            Instant expiresAt = clock.instant().plusSeconds(expiresIn).minus(TOKEN_EXPIRY_MARGIN);
            return new AccessTokenCache.TokenInfo(accessToken, expiresAt);
        } catch (IOException e) {
            throw new ProviderException(NAME, "token", "Token refresh failed: " + e.getMessage(), e);
        }
    }

    /** Site24x7 reports "-" for values it could not measure. */
    static int parseNumber(String value) {
        if (value == null || value.isBlank() || "-".equals(value.trim())) {
            return 0;
        }
        try {
            return (int) Math.round(Double.parseDouble(value.trim()));
        } catch (NumberFormatException e) {
            return 0;
        }
    }
}
