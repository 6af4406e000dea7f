package uk.gegc.bannertracking.features.analytics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.bannertracking.features.analytics.api.dto.AnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.BannerAnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.CampaignAnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.RecentEventDto;
import uk.gegc.bannertracking.features.analytics.api.dto.TopBannerDto;
import uk.gegc.bannertracking.features.analytics.application.AnalyticsService;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEvent;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;
import uk.gegc.bannertracking.features.analytics.domain.repository.AnalyticsEventRepository;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.model.Campaign;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.banner.domain.repository.CampaignRepository;
import uk.gegc.bannertracking.shared.exception.ResourceNotFoundException;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
@Transactional(readOnly = true)
public class AnalyticsServiceImpl implements AnalyticsService {

    private final AnalyticsEventRepository analyticsEventRepository;
    private final BannerRepository bannerRepository;
    private final CampaignRepository campaignRepository;
    private final Clock clock;

    @Value("${app.analytics.top-banners-limit:5}")
    private int topBannersLimit = 5;

    @Value("${app.analytics.recent-events-limit:10}")
    private int recentEventsLimit = 10;

    /**
     * Clicks per hundred views rounded half-up to two decimals; 0 when there are no views.
     */
    public static double clickThroughRate(long clicks, long views) {
        if (views <= 0) {
            return 0.0;
        }
        return BigDecimal.valueOf(clicks)
                .multiply(BigDecimal.valueOf(100))
                .divide(BigDecimal.valueOf(views), 2, RoundingMode.HALF_UP)
                .doubleValue();
    }

    @Override
    public AnalyticsSummaryDto getSummary(AnalyticsRange range) {
        AnalyticsRange window = range != null ? range : AnalyticsRange.DEFAULT;
        Instant to = Instant.now(clock);
        Instant from = window.startingAt(to);

        long clicks = analyticsEventRepository.countByEventTypeAndOccurredAtBetween(AnalyticsEventType.CLICK, from, to);
        long views = analyticsEventRepository.countByEventTypeAndOccurredAtBetween(AnalyticsEventType.VIEW, from, to);

        // Ranked by the lifetime counter, not by clicks inside the window
        List<TopBannerDto> topBanners = bannerRepository.findTopByLifetimeClicks(PageRequest.of(0, topBannersLimit))
                .stream()
                .map(banner -> new TopBannerDto(banner.getId(), banner.getName(), banner.getCurrentClicks()))
                .toList();

        List<AnalyticsEvent> recent = analyticsEventRepository.findByOccurredAtBetweenOrderByOccurredAtDesc(
                from, to, PageRequest.of(0, recentEventsLimit));

        log.debug("Analytics summary for {}: clicks={}, views={}, recent={}", window.getCode(), clicks, views, recent.size());

        return new AnalyticsSummaryDto(
                window,
                from,
                to,
                clicks,
                views,
                clickThroughRate(clicks, views),
                topBanners,
                toRecentEvents(recent)
        );
    }

    @Override
    public BannerAnalyticsSummaryDto getBannerSummary(UUID bannerId, AnalyticsRange range) {
        Banner banner = bannerRepository.findById(bannerId)
                .orElseThrow(() -> new ResourceNotFoundException("Banner " + bannerId + " not found"));

        AnalyticsRange window = range != null ? range : AnalyticsRange.DEFAULT;
        Instant to = Instant.now(clock);
        Instant from = window.startingAt(to);

        long clicks = analyticsEventRepository.countByBannerIdAndEventTypeAndOccurredAtBetween(
                bannerId, AnalyticsEventType.CLICK, from, to);
        long views = analyticsEventRepository.countByBannerIdAndEventTypeAndOccurredAtBetween(
                bannerId, AnalyticsEventType.VIEW, from, to);
        long uniqueRecipients = analyticsEventRepository.countDistinctRecipientsByBannerId(bannerId, from, to);

        return new BannerAnalyticsSummaryDto(
                banner.getId(),
                banner.getName(),
                window,
                clicks,
                views,
                clickThroughRate(clicks, views),
                banner.getCurrentClicks(),
                banner.getMaxClicks(),
                uniqueRecipients
        );
    }

    @Override
    public CampaignAnalyticsSummaryDto getCampaignSummary(UUID campaignId, AnalyticsRange range) {
        Campaign campaign = campaignRepository.findById(campaignId)
                .orElseThrow(() -> new ResourceNotFoundException("Campaign " + campaignId + " not found"));

        AnalyticsRange window = range != null ? range : AnalyticsRange.DEFAULT;
        Instant to = Instant.now(clock);
        Instant from = window.startingAt(to);

        long clicks = analyticsEventRepository.countByCampaignIdAndEventTypeAndOccurredAtBetween(
                campaignId, AnalyticsEventType.CLICK, from, to);
        long views = analyticsEventRepository.countByCampaignIdAndEventTypeAndOccurredAtBetween(
                campaignId, AnalyticsEventType.VIEW, from, to);
        int activeBanners = bannerRepository.findAllByActiveTrueAndCampaign_Id(campaignId).size();

        return new CampaignAnalyticsSummaryDto(
                campaign.getId(),
                campaign.getName(),
                window,
                clicks,
                views,
                clickThroughRate(clicks, views),
                activeBanners
        );
    }

    private List<RecentEventDto> toRecentEvents(List<AnalyticsEvent> events) {
        if (events.isEmpty()) {
            return List.of();
        }

        Set<UUID> bannerIds = events.stream()
                .map(AnalyticsEvent::getBannerId)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());
        Map<UUID, String> bannerNames = bannerRepository.findAllById(bannerIds).stream()
                .collect(Collectors.toMap(Banner::getId, Banner::getName, (a, b) -> a));

        return events.stream()
                .map(event -> new RecentEventDto(
                        event.getId(),
                        event.getEventType(),
                        event.getBannerId(),
                        event.getBannerId() != null ? bannerNames.get(event.getBannerId()) : null,
                        event.getCampaignId(),
                        event.getEmailRecipient(),
                        event.getOccurredAt()
                ))
                .toList();
    }
}
