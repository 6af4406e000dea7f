package uk.gegc.bannertracking.features.tracking.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Opaque per-recipient tracking link: a sender, a recipient and a banner behind one {@code tid}.
 */
@Entity
@Table(name = "email_tracking_sessions")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TrackingSession {

    @Id
    private UUID id;

    @Column(name = "tracking_id", length = 64, nullable = false, unique = true)
    private String trackingId;

    @Column(name = "sender_email", nullable = false)
    private String senderEmail;

    @Column(name = "recipient_email", nullable = false)
    private String recipientEmail;

    @Column(name = "banner_id", nullable = false)
    private UUID bannerId;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "last_clicked_at")
    private Instant lastClickedAt;

    // Only ever changed through TrackingSessionRepository#recordClick
    @Column(name = "click_count", nullable = false)
    private int clickCount;

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }
}
