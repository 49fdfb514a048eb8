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
 * Link between a local domain and one provider's remote monitor object.
 * A non-null external id always names a real remote monitor.
 */
@Entity
@Table(name = "monitor_registrations", indexes = {
        @Index(name = "idx_registration_domain", columnList = "domain_id"),
        @Index(name = "idx_registration_state", columnList = "state")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MonitorRegistration {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    private String id;

    @Column(name = "domain_id", nullable = false)
    private String domainId;

    @Column(nullable = false, length = 32)
    private String provider;

    /** Identifier assigned by the provider; null until creation succeeds */
    @Column(name = "external_id")
    private String externalId;

    /** Regions submitted to the provider, primary first, comma separated */
    @Column(length = 64)
    private String regions;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 32)
    @Builder.Default
    private State state = State.PENDING;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private Instant updatedAt;

    public boolean isLive() {
        return state == State.ACTIVE && externalId != null;
    }

    /** Whether a remote object may still exist for this registration */
    public boolean holdsRemoteMonitor() {
        return externalId != null && (state == State.ACTIVE || state == State.ORPHANED_PENDING_DELETE);
    }

    public enum State {
        PENDING, ACTIVE, ORPHANED_PENDING_DELETE, DELETED
    }
}
