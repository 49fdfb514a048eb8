package com.example.domainmonitor.notification;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.repository.ChannelConfigRepository;
import com.example.domainmonitor.repository.NotificationHistoryRepository;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * Fans a status observation out to one dispatcher per configured channel type.
 */
@Slf4j
@Service
public class NotificationService {

    private final List<NotificationDispatcher> dispatchers;

    @Autowired
    public NotificationService(ObjectProvider<ChannelSender> senders,
                               ChannelConfigRepository configRepository,
                               NotificationHistoryRepository historyRepository,
                               SuppressionPolicy policy,
                               MessageFormatter formatter,
                               MonitorProperties properties,
                               Clock clock,
                               MeterRegistry meterRegistry) {
        Duration retention = Duration.ofMinutes(properties.getSuppression().getCacheRetentionMinutes());
        this.dispatchers = senders.orderedStream()
                .map(sender -> new NotificationDispatcher(sender, configRepository, historyRepository, policy,
                        formatter, new SuppressionCache(clock, retention), clock, meterRegistry))
                .toList();
        log.info("Notification channels: {}", dispatchers.stream().map(NotificationDispatcher::channelType).toList());
    }

    NotificationService(List<NotificationDispatcher> dispatchers) {
        this.dispatchers = List.copyOf(dispatchers);
    }

    public List<ChannelConfig.ChannelType> getChannels() {
        return dispatchers.stream().map(NotificationDispatcher::channelType).toList();
    }

    /**
     * Notifies every channel about the domain's current status.
     *
     * @param transitioned whether availability changed with this observation
     */
    public void notifyStatus(Domain domain, boolean transitioned) {
        for (NotificationDispatcher dispatcher : dispatchers) {
            try {
                dispatcher.dispatch(domain, transitioned);
            } catch (RuntimeException e) {
                log.error("[{}] Notification dispatch for domain {} failed: {}",
                        dispatcher.channelType(), domain.getName(), e.getMessage(), e);
            }
        }
    }
}
