package uk.gegc.bannertracking.features.analytics.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEvent;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

@Repository
public interface AnalyticsEventRepository extends JpaRepository<AnalyticsEvent, UUID> {

    long countByEventTypeAndOccurredAtBetween(AnalyticsEventType eventType, Instant from, Instant to);

    long countByBannerIdAndEventTypeAndOccurredAtBetween(UUID bannerId, AnalyticsEventType eventType,
                                                         Instant from, Instant to);

    long countByCampaignIdAndEventTypeAndOccurredAtBetween(UUID campaignId, AnalyticsEventType eventType,
                                                           Instant from, Instant to);

    List<AnalyticsEvent> findByOccurredAtBetweenOrderByOccurredAtDesc(Instant from, Instant to, Pageable pageable);

    @Query("SELECT COUNT(DISTINCT e.emailRecipient) FROM AnalyticsEvent e " +
           "WHERE e.bannerId = :bannerId AND e.emailRecipient IS NOT NULL " +
           "AND e.occurredAt BETWEEN :from AND :to")
    long countDistinctRecipientsByBannerId(@Param("bannerId") UUID bannerId,
                                           @Param("from") Instant from,
                                           @Param("to") Instant to);
}
