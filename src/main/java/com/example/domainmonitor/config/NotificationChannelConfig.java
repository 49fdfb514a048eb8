package com.example.domainmonitor.config;

import com.example.domainmonitor.notification.EmailSender;
import com.example.domainmonitor.notification.TelegramSender;
import com.example.domainmonitor.provider.TickRateLimiter;
import com.example.domainmonitor.repository.ChannelConfigRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.OkHttpClient;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.annotation.Order;
import org.springframework.mail.javamail.JavaMailSender;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Channel senders. A disabled channel has no sender and therefore no dispatcher.
 */
@Configuration
public class NotificationChannelConfig {

    @Bean
    @Order(1)
    @ConditionalOnProperty(prefix = "domain-monitor.notifications.telegram", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public TelegramSender telegramSender(MonitorProperties properties, OkHttpClient httpClient,
                                         ObjectMapper objectMapper, ChannelConfigRepository configRepository) {
        MonitorProperties.NotificationConfig.TelegramConfig config = properties.getNotifications().getTelegram();
        return new TelegramSender(
                config.getBaseUrl(),
                config.getApiToken(),
                httpClient.newBuilder().callTimeout(config.getTimeoutSeconds(), TimeUnit.SECONDS).build(),
                objectMapper,
                new TickRateLimiter("telegram", Duration.ofMillis(config.getTickIntervalMillis())),
                configRepository);
    }

    @Bean
    @Order(2)
    @ConditionalOnProperty(prefix = "domain-monitor.notifications.email", name = "enabled",
            havingValue = "true", matchIfMissing = true)
    public EmailSender emailSender(MonitorProperties properties, JavaMailSender mailSender) {
        MonitorProperties.NotificationConfig.EmailConfig config = properties.getNotifications().getEmail();
        return new EmailSender(mailSender, config.getFromAddress(), config.getFromName());
    }
}
