package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.NotificationHistory;
import com.example.domainmonitor.domain.NotificationType;
import com.example.domainmonitor.repository.ChannelConfigRepository;
import com.example.domainmonitor.repository.NotificationHistoryRepository;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Sends status notifications of one channel type to the domain owner's configs.
 *
 * A whole dispatch runs under one lock so the cache check and the cache update of
 * concurrent dispatches cannot interleave. The cache is read once per dispatch; a
 * failure on one config never stops the others.
 */
@Slf4j
public class NotificationDispatcher {

    private final ChannelSender sender;
    private final ChannelConfigRepository configRepository;
    private final NotificationHistoryRepository historyRepository;
    private final SuppressionPolicy policy;
    private final MessageFormatter formatter;
    private final SuppressionCache cache;
    private final Clock clock;
    private final MeterRegistry meterRegistry;
    private final ReentrantLock lock = new ReentrantLock();

    public NotificationDispatcher(ChannelSender sender, ChannelConfigRepository configRepository,
                                  NotificationHistoryRepository historyRepository, SuppressionPolicy policy,
                                  MessageFormatter formatter, SuppressionCache cache, Clock clock,
                                  MeterRegistry meterRegistry) {
        this.sender = sender;
        this.configRepository = configRepository;
        this.historyRepository = historyRepository;
        this.policy = policy;
        this.formatter = formatter;
        this.cache = cache;
        this.clock = clock;
        this.meterRegistry = meterRegistry;
    }

    public ChannelConfig.ChannelType channelType() {
        return sender.channelType();
    }

    /**
     * @param transitioned whether availability changed with the observation being reported
     * @return number of configs the notification was delivered to
     */
    public int dispatch(Domain domain, boolean transitioned) {
        ChannelConfig.ChannelType channel = sender.channelType();
        List<ChannelConfig> configs = configRepository.findByUserIdAndChannelType(domain.getUserId(), channel);
        if (configs.isEmpty()) {
            return 0;
        }
        NotificationType type = NotificationType.of(domain, transitioned);

        lock.lock();
        try {
            cache.evictExpired();
            Instant now = clock.instant();
            Duration window = policy.window(domain.getInterval(), type);
            Optional<Instant> cachedLastSent = cache.lastSent(domain.getId(), type);
            if (policy.withinWindow(cachedLastSent, window, now)) {
                log.debug("[{}] Skipping {} notification of {}: last sent at {} (window {})",
                        channel, type.code(), domain.getName(), cachedLastSent.get(), window);
                count(type, "suppressed");
                return 0;
            }

            NotificationMessage message = null;
            int delivered = 0;
            for (ChannelConfig config : configs) {
                if (!policy.shouldSend(domain, type, config, cachedLastSent, now)) {
                    count(type, "suppressed");
                    continue;
                }
                if (message == null) {
                    message = formatter.format(domain, type);
                }
                try {
                    sender.send(config.getAddress(), message);
                } catch (RuntimeException e) {
                    log.error("[{}] Failed to send {} notification of {} to {} ({}): {}",
                            channel, type.code(), domain.getName(), config.label(), config.getId(), e.getMessage());
                    count(type, "failed");
                    continue;
                }
                delivered++;
                count(type, "sent");
                recordHistory(domain, config, type, now);
                cache.recordSent(domain.getId(), type, now);
            }
            if (delivered > 0) {
                log.info("[{}] Sent {} notification of {} to {} configs", channel, type.code(), domain.getName(), delivered);
            }
            return delivered;
        } finally {
            lock.unlock();
        }
    }

    private void recordHistory(Domain domain, ChannelConfig config, NotificationType type, Instant now) {
        try {
            historyRepository.save(NotificationHistory.builder()
                    .domainId(domain.getId())
                    .channelConfigId(config.getId())
                    .channelType(config.getChannelType())
                    .statusCode(domain.getLastStatus())
                    .errorCode(domain.getErrorCode())
                    .errorDescription(domain.getErrorDescription())
                    .notificationType(type)
                    .notifiedAt(now)
                    .build());
        } catch (DataAccessException e) {
            log.error("Failed to record {} notification history of {} for config {}: {}",
                    type.code(), domain.getName(), config.getId(), e.getMessage());
        }
    }

    private void count(NotificationType type, String outcome) {
        Counter.builder("domain_monitor.notifications.total")
                .tag("channel", sender.channelType().name().toLowerCase())
                .tag("type", type.code())
                .tag("outcome", outcome)
                .register(meterRegistry)
                .increment();
    }
}
