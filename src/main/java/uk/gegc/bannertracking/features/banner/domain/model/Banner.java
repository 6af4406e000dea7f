package uk.gegc.bannertracking.features.banner.domain.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.UpdateTimestamp;

import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.Set;
import java.util.UUID;

@Entity
@Table(name = "banners")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class Banner {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    @Column(name = "name", nullable = false)
    private String name;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "campaign_id")
    private Campaign campaign;

    @Column(name = "html_content", nullable = false, columnDefinition = "TEXT")
    private String htmlContent;

    @Column(name = "image_url", length = 2048)
    private String imageUrl;

    @Column(name = "click_url", length = 2048)
    private String clickUrl;

    @Column(name = "is_active", nullable = false)
    private boolean active = true;

    @Column(name = "start_date")
    private Instant startDate;

    @Column(name = "end_date")
    private Instant endDate;

    // Only ever changed through BannerRepository#incrementClicksIfBelowCap
    @Column(name = "current_clicks", nullable = false)
    private int currentClicks;

    @Column(name = "max_clicks")
    private Integer maxClicks;

    @Column(name = "priority", nullable = false)
    private int priority;

    @Convert(converter = StringSetConverter.class)
    @Column(name = "target_departments", columnDefinition = "TEXT")
    private Set<String> targetDepartments = new LinkedHashSet<>();

    @Convert(converter = StringSetConverter.class)
    @Column(name = "device_targeting", columnDefinition = "TEXT")
    private Set<String> deviceTargeting = new LinkedHashSet<>();

    @Convert(converter = StringSetConverter.class)
    @Column(name = "geo_targeting", columnDefinition = "TEXT")
    private Set<String> geoTargeting = new LinkedHashSet<>();

    @Convert(converter = StringSetConverter.class)
    @Column(name = "target_audience", columnDefinition = "TEXT")
    private Set<String> targetAudience = new LinkedHashSet<>();

    @CreationTimestamp
    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public UUID getCampaignId() {
        return campaign != null ? campaign.getId() : null;
    }

    public boolean hasClickCap() {
        return maxClicks != null;
    }
}
