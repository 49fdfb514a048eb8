package com.example.domainmonitor.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.HashSet;
import java.util.Set;

/**
 * A user's notification endpoint: a Telegram chat or an email address.
 */
@Entity
@Table(name = "channel_configs", indexes = {
        @Index(name = "idx_channel_user_type", columnList = "user_id, channel_type")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ChannelConfig {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    @Enumerated(EnumType.STRING)
    @Column(name = "channel_type", nullable = false, length = 16)
    private ChannelType channelType;

    /** Chat id or email address */
    @Column(nullable = false)
    private String address;

    @Column(name = "display_name")
    private String displayName;

    @Builder.Default
    private String language = "en";

    @Builder.Default
    private boolean active = true;

    @Column(name = "notify_on_down")
    @Builder.Default
    private boolean notifyOnDown = true;

    @Column(name = "notify_on_up")
    @Builder.Default
    private boolean notifyOnUp = true;

    /** Regions to notify for; empty means every region */
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "channel_config_regions", joinColumns = @JoinColumn(name = "channel_config_id"))
    @Column(name = "region_code", length = 10)
    @Builder.Default
    private Set<String> regions = new HashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean coversRegion(String region) {
        return regions == null || regions.isEmpty() || regions.contains(region);
    }

    public String label() {
        return displayName != null && !displayName.isBlank() ? displayName : address;
    }

    public enum ChannelType {
        TELEGRAM, EMAIL
    }
}
