package com.example.domainmonitor.provider;

import com.example.domainmonitor.region.RegionResolver;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;

/**
 * HTTP plumbing shared by the provider clients: rate-limited execution, status checks,
 * JSON handling and call counters.
 */
public abstract class AbstractProviderClient implements ProviderClient {

    protected static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final int MAX_ERROR_BODY = 500;

    private final String name;
    protected final OkHttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final TickRateLimiter rateLimiter;
    private final RegionResolver regions;
    private final MeterRegistry meterRegistry;

    protected AbstractProviderClient(String name, OkHttpClient httpClient, ObjectMapper objectMapper,
                                     TickRateLimiter rateLimiter, RegionResolver regions,
                                     MeterRegistry meterRegistry) {
        this.name = name;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.rateLimiter = rateLimiter;
        this.regions = regions;
        this.meterRegistry = meterRegistry;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public RegionResolver regions() {
        return regions;
    }

    /**
     * Waits for a rate-limiter tick, executes the request and returns the response body.
     *
     * @param acceptedStatus HTTP codes treated as success
     * @throws ProviderException on transport failure or any other status
     */
    protected String execute(String operation, String identifier, Request request, int... acceptedStatus) {
        awaitTick(operation, identifier);
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String body = responseBody != null ? responseBody.string() : "";
            if (!accepted(response.code(), acceptedStatus)) {
                countCall(operation, "error");
                throw new ProviderException(name, operation, response.code(),
                        String.format("%s %s for %s returned HTTP %d: %s",
                                name, operation, identifier, response.code(), abbreviate(body)));
            }
            countCall(operation, "success");
            return body;
        } catch (IOException e) {
            countCall(operation, "error");
            throw new ProviderException(name, operation,
                    String.format("%s %s for %s failed: %s", name, operation, identifier, e.getMessage()), e);
        }
    }

    protected JsonNode readJson(String operation, String body) {
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name, operation, "Unreadable response body: " + abbreviate(body), e);
        }
    }

    protected RequestBody jsonBody(String operation, Object payload) {
        try {
            return RequestBody.create(objectMapper.writeValueAsString(payload), JSON);
        } catch (JsonProcessingException e) {
            throw new ProviderException(name, operation, "Could not serialize request", e);
        }
    }

    private void awaitTick(String operation, String identifier) {
        try {
            rateLimiter.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ProviderException(name, operation,
                    "Interrupted while waiting for rate limiter (" + identifier + ")", e);
        } catch (IllegalStateException e) {
            throw new ProviderException(name, operation, e.getMessage() + " (" + identifier + ")", e);
        }
    }

    private void countCall(String operation, String outcome) {
        Counter.builder("domain_monitor.provider.calls")
                .tag("provider", name)
                .tag("operation", operation)
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }

    private static boolean accepted(int status, int[] acceptedStatus) {
        for (int code : acceptedStatus) {
            if (code == status) {
                return true;
            }
        }
        return false;
    }

    private static String abbreviate(String body) {
        if (body == null) {
            return "";
        }
        return body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body;
    }
}
