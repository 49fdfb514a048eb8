package com.example.domainmonitor.notification;

import com.example.domainmonitor.config.MonitorProperties;
import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.NotificationType;
import com.example.domainmonitor.repository.NotificationHistoryRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Decides whether a notification may go to a channel config.
 *
 * The suppression window is the domain's interval, halved for up/down transitions and
 * never shorter than the configured minimum. A send is suppressed when the in-memory cache
 * or the persisted history holds a send of the same type inside the window.
 */
@Slf4j
@Component
public class SuppressionPolicy {

    private final NotificationHistoryRepository historyRepository;
    private final Duration minimumWindow;

    @Autowired
    public SuppressionPolicy(NotificationHistoryRepository historyRepository, MonitorProperties properties) {
        this(historyRepository, Duration.ofMinutes(properties.getSuppression().getMinimumWindowMinutes()));
    }

    SuppressionPolicy(NotificationHistoryRepository historyRepository, Duration minimumWindow) {
        this.historyRepository = historyRepository;
        this.minimumWindow = minimumWindow;
    }

    public Duration window(int intervalMinutes, NotificationType type) {
        Duration window = Duration.ofMinutes(intervalMinutes);
        if (type.isTransition()) {
            window = window.dividedBy(2);
        }
        return window.compareTo(minimumWindow) < 0 ? minimumWindow : window;
    }

    /**
     * @param cachedLastSent last send of this domain and type seen by the dispatcher, if any
     */
    public boolean shouldSend(Domain domain, NotificationType type, ChannelConfig config,
                              Optional<Instant> cachedLastSent, Instant now) {
        if (!isEligible(domain, type, config)) {
            return false;
        }
        Duration window = window(domain.getInterval(), type);
        if (withinWindow(cachedLastSent, window, now)) {
            return false;
        }
        Optional<Instant> lastNotified = historyRepository.findLastNotifiedAt(domain.getId(), config.getId(), type);
        if (withinWindow(lastNotified, window, now)) {
            log.debug("Skipping {} notification of {} to {}: last sent at {} (window {})",
                    type.code(), domain.getName(), config.label(), lastNotified.get(), window);
            return false;
        }
        return true;
    }

    /**
     * Config-level filters: active flag, region filter and the up/down switches.
     */
    public boolean isEligible(Domain domain, NotificationType type, ChannelConfig config) {
        if (!config.isActive()) {
            log.debug("Skipping {}: config inactive", config.label());
            return false;
        }
        if (!config.coversRegion(domain.getRegion())) {
            log.debug("Skipping {} for {}: region {} not in {}", config.label(), domain.getName(),
                    domain.getRegion(), config.getRegions());
            return false;
        }
        if (type == NotificationType.UP && !config.isNotifyOnUp()) {
            log.debug("Skipping up notification of {} to {}: notify-on-up disabled", domain.getName(), config.label());
            return false;
        }
        if (type == NotificationType.DOWN && !config.isNotifyOnDown()) {
            log.debug("Skipping down notification of {} to {}: notify-on-down disabled", domain.getName(), config.label());
            return false;
        }
        return true;
    }

    public boolean withinWindow(Optional<Instant> lastSent, Duration window, Instant now) {
        return lastSent.isPresent() && Duration.between(lastSent.get(), now).compareTo(window) < 0;
    }
}
