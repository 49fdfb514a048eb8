package com.example.domainmonitor.repository;

import com.example.domainmonitor.domain.ChannelConfig;
import com.example.domainmonitor.domain.NotificationHistory;
import com.example.domainmonitor.domain.NotificationType;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.boot.test.autoconfigure.orm.jpa.TestEntityManager;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DataJpaTest
class NotificationHistoryRepositoryTest {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    @Autowired
    private TestEntityManager entityManager;

    @Autowired
    private NotificationHistoryRepository historyRepository;

    @Autowired
    private ChannelConfigRepository configRepository;

    @Test
    void lastNotifiedAtIsTheLatestMatchingSend() {
        // given
        persistHistory("d1", "c1", NotificationType.DOWN, T0);
        persistHistory("d1", "c1", NotificationType.DOWN, T0.plusSeconds(660));
        persistHistory("d1", "c1", NotificationType.UP, T0.plusSeconds(900));
        persistHistory("d1", "c2", NotificationType.DOWN, T0.plusSeconds(1200));
        entityManager.flush();

        // then
        assertThat(historyRepository.findLastNotifiedAt("d1", "c1", NotificationType.DOWN))
                .contains(T0.plusSeconds(660));
        assertThat(historyRepository.findLastNotifiedAt("d1", "c1", NotificationType.STATUS)).isEmpty();
        assertThat(historyRepository.findLastNotifiedAt("d2", "c1", NotificationType.DOWN)).isEmpty();
    }

    @Test
    void historyIsDeletedWithItsDomains() {
        // given
        persistHistory("d1", "c1", NotificationType.DOWN, T0);
        persistHistory("d2", "c1", NotificationType.DOWN, T0);
        entityManager.flush();

        // when
        int deleted = historyRepository.deleteByDomainIdIn(List.of("d1"));

        // then
        assertThat(deleted).isEqualTo(1);
        assertThat(historyRepository.findLastNotifiedAt("d1", "c1", NotificationType.DOWN)).isEmpty();
        assertThat(historyRepository.findLastNotifiedAt("d2", "c1", NotificationType.DOWN)).contains(T0);
    }

    @Test
    void migratedChatAddressIsRewrittenForTelegramOnly() {
        // given
        ChannelConfig telegram = persistConfig(ChannelConfig.ChannelType.TELEGRAM, "-100");
        ChannelConfig other = persistConfig(ChannelConfig.ChannelType.TELEGRAM, "-300");
        ChannelConfig email = persistConfig(ChannelConfig.ChannelType.EMAIL, "-100");
        entityManager.flush();

        // when
        int moved = configRepository.updateAddress(ChannelConfig.ChannelType.TELEGRAM, "-100", "-1001234");
        entityManager.clear();

        // then
        assertThat(moved).isEqualTo(1);
        assertThat(configRepository.findById(telegram.getId()).orElseThrow().getAddress()).isEqualTo("-1001234");
        assertThat(configRepository.findById(other.getId()).orElseThrow().getAddress()).isEqualTo("-300");
        assertThat(configRepository.findById(email.getId()).orElseThrow().getAddress()).isEqualTo("-100");
    }

    private void persistHistory(String domainId, String configId, NotificationType type, Instant at) {
        entityManager.persist(NotificationHistory.builder()
                .domainId(domainId)
                .channelConfigId(configId)
                .channelType(ChannelConfig.ChannelType.TELEGRAM)
                .statusCode(503)
                .notificationType(type)
                .notifiedAt(at)
                .build());
    }

    private ChannelConfig persistConfig(ChannelConfig.ChannelType type, String address) {
        return entityManager.persist(ChannelConfig.builder()
                .userId("u1")
                .channelType(type)
                .address(address)
                .build());
    }
}
