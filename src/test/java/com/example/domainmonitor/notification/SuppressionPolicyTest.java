package com.example.domainmonitor.notification;

import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.domain.Domain;
import com.example.domainmonitor.domain.NotificationType;
import com.example.domainmonitor.repository.NotificationHistoryRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.BDDMockito.given;

@ExtendWith(MockitoExtension.class)
class SuppressionPolicyTest {

    private static final Instant NOW = Instant.parse("2024-05-01T10:00:00Z");

    @Mock
    private NotificationHistoryRepository historyRepository;

    private SuppressionPolicy policy() {
        return new SuppressionPolicy(historyRepository, Duration.ofMinutes(2));
    }

    @Test
    void transitionsUseHalfTheIntervalAndStatusUpdatesTheWholeInterval() {
        SuppressionPolicy policy = policy();

        assertEquals(Duration.ofMinutes(10), policy.window(20, NotificationType.DOWN));
        assertEquals(Duration.ofMinutes(10), policy.window(20, NotificationType.UP));
        assertEquals(Duration.ofMinutes(20), policy.window(20, NotificationType.STATUS));
        assertEquals(Duration.ofMinutes(60), policy.window(120, NotificationType.UP));
    }

    @Test
    void windowNeverDropsBelowTheMinimum() {
        SuppressionPolicy policy = policy();

        assertEquals(Duration.ofMinutes(2), policy.window(3, NotificationType.DOWN));
        assertEquals(Duration.ofMinutes(2), policy.window(1, NotificationType.STATUS));
    }

    @Test
    void configFiltersAreApplied() {
        SuppressionPolicy policy = policy();
        Domain domain = domain("TH");

        assertTrue(policy.isEligible(domain, NotificationType.DOWN, config(c -> { })));
        assertFalse(policy.isEligible(domain, NotificationType.DOWN, config(c -> c.setActive(false))));
        assertFalse(policy.isEligible(domain, NotificationType.DOWN, config(c -> c.setRegions(Set.of("JP")))));
        assertTrue(policy.isEligible(domain, NotificationType.DOWN, config(c -> c.setRegions(Set.of("JP", "TH")))));
        assertFalse(policy.isEligible(domain, NotificationType.UP, config(c -> c.setNotifyOnUp(false))));
        assertTrue(policy.isEligible(domain, NotificationType.DOWN, config(c -> c.setNotifyOnUp(false))));
        assertFalse(policy.isEligible(domain, NotificationType.DOWN, config(c -> c.setNotifyOnDown(false))));
        assertTrue(policy.isEligible(domain, NotificationType.STATUS, config(c -> c.setNotifyOnDown(false))));
    }

    @Test
    void cachedSendInsideTheWindowSuppresses() {
        SuppressionPolicy policy = policy();

        assertFalse(policy.shouldSend(domain("TH"), NotificationType.DOWN, config(c -> { }),
                Optional.of(NOW.minus(Duration.ofMinutes(9))), NOW));
    }

    @Test
    void historyIsCheckedPerConfig() {
        // given
        given(historyRepository.findLastNotifiedAt("d1", "c1", NotificationType.DOWN))
                .willReturn(Optional.of(NOW.minus(Duration.ofMinutes(4))));
        given(historyRepository.findLastNotifiedAt("d1", "c2", NotificationType.DOWN))
                .willReturn(Optional.of(NOW.minus(Duration.ofMinutes(10))));
        SuppressionPolicy policy = policy();

        // then
        assertFalse(policy.shouldSend(domain("TH"), NotificationType.DOWN, config(c -> { }), Optional.empty(), NOW));
        assertTrue(policy.shouldSend(domain("TH"), NotificationType.DOWN, config(c -> c.setId("c2")),
                Optional.empty(), NOW));
    }

    private static Domain domain(String region) {
        return Domain.builder()
                .id("d1")
                .userId("u1")
                .name("example.com")
                .url("https://example.com")
                .region(region)
                .interval(20)
                .build();
    }

    private static ChannelConfig config(Consumer<ChannelConfig> customizer) {
        ChannelConfig config = ChannelConfig.builder()
                .id("c1")
                .userId("u1")
                .channelType(ChannelConfig.ChannelType.TELEGRAM)
                .address("-100")
                .build();
        customizer.accept(config);
        return config;
    }
}
