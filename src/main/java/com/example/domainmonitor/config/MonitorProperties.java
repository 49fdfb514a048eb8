package com.example.domainmonitor.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Central configuration for the domain monitor.
 * Maps to the 'domain-monitor' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "domain-monitor")
public class MonitorProperties {

    private OrchestratorConfig orchestrator = new OrchestratorConfig();
    private ReconcilerConfig reconciler = new ReconcilerConfig();
    private DomainConfig domains = new DomainConfig();
    private SuppressionConfig suppression = new SuppressionConfig();
    private ProvidersConfig providers = new ProvidersConfig();
    private NotificationConfig notifications = new NotificationConfig();

    @Data
    public static class OrchestratorConfig {
        /** Delay before remote monitors are created for a new domain */
        private int creationDelaySeconds = 2;
        private int workerThreads = 2;
        private int queueCapacity = 500;
    }

    @Data
    public static class ReconcilerConfig {
        private boolean enabled = true;
        private long periodMillis = 60_000;
    }

    @Data
    public static class DomainConfig {
        private int defaultInterval = 20;
        private List<Integer> allowedIntervals = new ArrayList<>(List.of(10, 20, 30, 60, 120));
        private int limitPerUser = 100;
        private int maxBatchSize = 100;
    }

    @Data
    public static class SuppressionConfig {
        private int minimumWindowMinutes = 2;
        /** In-memory suppression entries older than this are evicted */
        private int cacheRetentionMinutes = 240;
    }

    @Data
    public static class ProvidersConfig {
        private UptrendsConfig uptrends = new UptrendsConfig();
        private Site24x7Config site24x7 = new Site24x7Config();

        @Data
        public static class UptrendsConfig {
            private boolean enabled = true;
            private String baseUrl = "https://api.uptrends.com/v4";
            private String username = "";
            private String apiKey = "";
            private long tickIntervalMillis = 1000;
            private int timeoutSeconds = 10;
        }

        @Data
        public static class Site24x7Config {
            private boolean enabled = true;
            private String baseUrl = "https://www.site24x7.com/api";
            private String tokenUrl = "https://accounts.zoho.com/oauth/v2/token";
            private String clientId = "";
            private String clientSecret = "";
            private String refreshToken = "";
            private long tickIntervalMillis = 500;
            private int timeoutSeconds = 30;
            private String notificationProfileId = "567462000000029001";
            private String thresholdProfileId = "567462000000029007";
            private String userGroupId = "567462000000025009";
        }
    }

    @Data
    public static class NotificationConfig {
        private String displayZone = "Asia/Hong_Kong";
        private int slowResponseMillis = 2000;
        private TelegramConfig telegram = new TelegramConfig();
        private EmailConfig email = new EmailConfig();

        @Data
        public static class TelegramConfig {
            private boolean enabled = true;
            private String baseUrl = "https://api.telegram.org/bot";
            private String apiToken = "";
            private long tickIntervalMillis = 500;
            private int timeoutSeconds = 10;
        }

        @Data
        public static class EmailConfig {
            private boolean enabled = true;
            private String fromAddress = "alerts@localhost";
            private String fromName = "Domain Monitor";
        }
    }
}
