package com.example.domainmonitor.config;

import com.example.domainmonitor.provider.TickRateLimiter;
import com.example.domainmonitor.provider.site24x7.Site24x7Client;
import com.example.domainmonitor.provider.uptrends.UptrendsClient;
import com.example.domainmonitor.region.RegionResolver;
import com.example.domainmonitor.region.RegionTables;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Provider client beans. Each provider gets its own rate limiter and a call timeout on top
 * of the shared HTTP client. Registration order is the order monitors are created in.
 */
@Slf4j
@Configuration
public class ProviderConfig {

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "domain-monitor.providers.uptrends", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public UptrendsClient uptrendsClient(MonitorProperties properties, OkHttpClient httpClient,
                                         ObjectMapper objectMapper, MeterRegistry meterRegistry, Clock clock) {
        MonitorProperties.ProvidersConfig.UptrendsConfig config = properties.getProviders().getUptrends();
        log.info("Uptrends provider enabled at {}", config.getBaseUrl());
        return new UptrendsClient(
                config.getBaseUrl(),
                config.getUsername(),
                config.getApiKey(),
                withTimeout(httpClient, config.getTimeoutSeconds()),
                objectMapper,
                new TickRateLimiter(UptrendsClient.NAME, Duration.ofMillis(config.getTickIntervalMillis())),
                new RegionResolver(RegionTables.UPTRENDS),
                meterRegistry,
                clock);
    }

    @Bean
    @Order(2)
    @ConditionalOnProperty(prefix = "domain-monitor.providers.site24x7", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public Site24x7Client site24x7Client(MonitorProperties properties, OkHttpClient httpClient,
                                         ObjectMapper objectMapper, MeterRegistry meterRegistry, Clock clock) {
        MonitorProperties.ProvidersConfig.Site24x7Config config = properties.getProviders().getSite24x7();
        log.info("Site24x7 provider enabled at {}", config.getBaseUrl());
        return new Site24x7Client(
                config.getBaseUrl(),
                new Site24x7Client.OAuthCredentials(config.getTokenUrl(), config.getClientId(),
                        config.getClientSecret(), config.getRefreshToken()),
                new Site24x7Client.Profiles(config.getNotificationProfileId(), config.getThresholdProfileId(),
                        config.getUserGroupId()),
                withTimeout(httpClient, config.getTimeoutSeconds()),
                objectMapper,
                new TickRateLimiter(Site24x7Client.NAME, Duration.ofMillis(config.getTickIntervalMillis())),
                new RegionResolver(RegionTables.SITE24X7),
                meterRegistry,
                clock);
    }

    static OkHttpClient withTimeout(OkHttpClient shared, int timeoutSeconds) {
        return shared.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }
}
