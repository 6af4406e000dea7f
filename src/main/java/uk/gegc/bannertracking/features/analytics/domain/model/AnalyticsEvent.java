package uk.gegc.bannertracking.features.analytics.domain.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

/**
 * One recorded banner interaction. Rows are append-only: written once by the tracking
 * endpoints and never updated.
 */
@Entity
@Table(name = "analytics_events")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalyticsEvent {

    @Id
    private UUID id;

    @Column(name = "event_type", length = 16, nullable = false)
    @Enumerated(EnumType.STRING)
    private AnalyticsEventType eventType;

    @Column(name = "banner_id")
    private UUID bannerId;

    @Column(name = "campaign_id")
    private UUID campaignId;

    @Column(name = "email_recipient")
    private String emailRecipient;

    @Column(name = "occurred_at", nullable = false)
    private Instant occurredAt;

    @Column(name = "user_agent", length = 256)
    private String userAgent; // Truncated to 256 chars

    @Column(name = "referrer", length = 512)
    private String referrer; // Truncated to 512 chars

    @Column(name = "ip_address", length = 45)
    private String ipAddress;

    @Convert(converter = EventMetadataConverter.class)
    @Column(name = "metadata", columnDefinition = "TEXT")
    @Builder.Default
    private Map<String, String> metadata = new LinkedHashMap<>();

    @PrePersist
    protected void onCreate() {
        if (id == null) {
            id = UUID.randomUUID();
        }
        if (occurredAt == null) {
            occurredAt = Instant.now();
        }
    }
}
