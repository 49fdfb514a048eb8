package com.example.domainmonitor.repository;

import com.example.domainmonitor.domain.NotificationHistory;
import com.example.domainmonitor.domain.NotificationType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

@Repository
public interface NotificationHistoryRepository extends JpaRepository<NotificationHistory, String> {

    @Query("SELECT MAX(h.notifiedAt) FROM NotificationHistory h WHERE h.domainId = :domainId "
            + "AND h.channelConfigId = :channelConfigId AND h.notificationType = :type")
    Optional<Instant> findLastNotifiedAt(String domainId, String channelConfigId, NotificationType type);

    @Modifying
    @Transactional
    @Query("DELETE FROM NotificationHistory h WHERE h.domainId IN :domainIds")
    int deleteByDomainIdIn(Collection<String> domainIds);
}
