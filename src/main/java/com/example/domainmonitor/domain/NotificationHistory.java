package com.example.domainmonitor.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Append-only record of a notification that was actually delivered.
 * Doubles as the durable half of the suppression state.
 */
@Entity
@Table(name = "notification_history", indexes = {
        @Index(name = "idx_history_lookup", columnList = "domain_id, channel_config_id, notification_type"),
        @Index(name = "idx_history_domain", columnList = "domain_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class NotificationHistory {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "domain_id", nullable = false)
    private String domainId;

    @Column(name = "channel_config_id", nullable = false)
    private String channelConfigId;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel_type", nullable = false, length = 16)
    private ChannelConfig.ChannelType channelType;

    @Column(name = "status_code")
    private int statusCode;

    @Column(name = "error_code")
    private int errorCode;

    @Column(name = "error_description", length = 2048)
    private String errorDescription;

    @Enumerated(EnumType.STRING)
    @Column(name = "notification_type", nullable = false, length = 16)
    private NotificationType notificationType;

    @Column(name = "notified_at", nullable = false)
    private Instant notifiedAt;
}
