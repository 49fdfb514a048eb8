package com.example.domainmonitor.domain;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;

/**
 * A web domain whose availability is checked by the external providers.
 * Status fields are written by the reconciler; settings by the owner.
 */
@Entity
@Table(name = "domains", indexes = {
        @Index(name = "idx_domains_user", columnList = "user_id"),
        @Index(name = "idx_domains_active", columnList = "active")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Domain {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "user_id", nullable = false)
    private String userId;

    /** Name as entered by the owner, e.g. "example.com" */
    @Column(nullable = false)
    private String name;

    /** Canonical URL submitted to the providers */
    @Column(nullable = false)
    private String url;

    @Builder.Default
    private boolean active = true;

    /** Poll interval in minutes */
    @Column(name = "check_interval", nullable = false)
    @Builder.Default
    private int interval = 20;

    @Column(nullable = false, length = 10)
    private String region;

    @Column(name = "last_status")
    private int lastStatus;

    @Column(name = "error_code")
    private int errorCode;

    @Column(name = "error_description", length = 2048)
    private String errorDescription;

    /** Total response time of the last check in milliseconds */
    @Column(name = "total_time")
    private int totalTime;

    @Column(name = "last_check_at")
    private Instant lastCheckAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    /**
     * Available means a check was recorded and its status code is in [200, 400).
     */
    public boolean isAvailable() {
        if (lastCheckAt == null) {
            return false;
        }
        return lastStatus >= 200 && lastStatus < 400;
    }

    public void recordStatus(int statusCode, int errorCode, String errorDescription, int totalTime,
                             Instant checkedAt) {
        this.lastStatus = statusCode;
        this.errorCode = errorCode;
        this.errorDescription = errorDescription;
        this.totalTime = totalTime;
        this.lastCheckAt = checkedAt;
    }
}
