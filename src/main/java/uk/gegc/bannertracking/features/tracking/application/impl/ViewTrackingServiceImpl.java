package uk.gegc.bannertracking.features.tracking.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.bannertracking.features.analytics.application.AnalyticsEventService;
import uk.gegc.bannertracking.features.analytics.application.RecordEventCommand;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.tracking.application.TrackingMetricsService;
import uk.gegc.bannertracking.features.tracking.application.ViewRequest;
import uk.gegc.bannertracking.features.tracking.application.ViewTrackingService;
import uk.gegc.bannertracking.features.tracking.config.TrackingProperties;
import uk.gegc.bannertracking.features.tracking.domain.model.TrackingSession;
import uk.gegc.bannertracking.features.tracking.domain.repository.TrackingSessionRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

@Service
@Slf4j
public class ViewTrackingServiceImpl implements ViewTrackingService {

    private final BannerRepository bannerRepository;
    private final TrackingSessionRepository trackingSessionRepository;
    private final AnalyticsEventService analyticsEventService;
    private final TrackingMetricsService trackingMetricsService;
    private final TrackingProperties trackingProperties;
    private final Executor trackingTaskExecutor;
    private final Clock clock;

    public ViewTrackingServiceImpl(BannerRepository bannerRepository,
                                   TrackingSessionRepository trackingSessionRepository,
                                   AnalyticsEventService analyticsEventService,
                                   TrackingMetricsService trackingMetricsService,
                                   TrackingProperties trackingProperties,
                                   @Qualifier("trackingTaskExecutor") Executor trackingTaskExecutor,
                                   Clock clock) {
        this.bannerRepository = bannerRepository;
        this.trackingSessionRepository = trackingSessionRepository;
        this.analyticsEventService = analyticsEventService;
        this.trackingMetricsService = trackingMetricsService;
        this.trackingProperties = trackingProperties;
        this.trackingTaskExecutor = trackingTaskExecutor;
        this.clock = clock;
    }

    @Override
    public boolean recordView(ViewRequest request) {
        boolean recorded = false;
        try {
            recorded = doRecord(request);
        } catch (RuntimeException e) {
            log.error("Unexpected failure recording view for banner: {}", request.bannerId(), e);
        }
        trackingMetricsService.recordView(recorded);
        return recorded;
    }

    private boolean doRecord(ViewRequest request) {
        String trackingId = StringUtils.hasText(request.trackingId()) ? request.trackingId().trim() : null;
        UUID bannerId = parseBannerId(request.bannerId());

        if (trackingId == null && bannerId == null) {
            log.debug("View request without a valid banner id: '{}'", request.bannerId());
            return false;
        }

        try {
            return CompletableFuture
                    .supplyAsync(() -> lookupAndRecord(bannerId, trackingId, request), trackingTaskExecutor)
                    .get(trackingProperties.getStoreTimeout().toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            log.warn("Recording view for banner {} did not finish within {}",
                    bannerId, trackingProperties.getStoreTimeout());
            trackingMetricsService.recordStoreTimeout("view");
            return false;
        } catch (RejectedExecutionException e) {
            log.warn("Tracking executor saturated, view for banner {} not recorded", bannerId);
            trackingMetricsService.recordStoreRejected("view");
            return false;
        } catch (ExecutionException e) {
            log.error("Failed to record view for banner: {}", bannerId, e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private boolean lookupAndRecord(UUID bannerId, String trackingId, ViewRequest request) {
        String recipient = request.email();
        UUID resolvedBannerId = bannerId;

        if (trackingId != null) {
            Optional<TrackingSession> session =
                    trackingSessionRepository.findActiveByTrackingId(trackingId, Instant.now(clock));
            if (session.isPresent()) {
                resolvedBannerId = session.get().getBannerId();
                recipient = session.get().getRecipientEmail();
            } else if (bannerId == null) {
                log.debug("View for unknown or expired tracking id: {}", trackingId);
                return false;
            }
        }

        Optional<Banner> banner = bannerRepository.findWithCampaignById(resolvedBannerId);
        if (banner.isEmpty()) {
            log.debug("View for unknown banner: {}", resolvedBannerId);
            return false;
        }

        Map<String, String> metadata = new LinkedHashMap<>();
        if (trackingId != null) {
            metadata.put(ClickTrackingServiceImpl.METADATA_TRACKING_ID, trackingId);
        }

        return analyticsEventService.recordEvent(new RecordEventCommand(
                AnalyticsEventType.VIEW,
                banner.get().getId(),
                banner.get().getCampaignId(),
                recipient,
                request.userAgent(),
                request.referrer(),
                request.ipAddress(),
                metadata
        ));
    }

    private static UUID parseBannerId(String raw) {
        if (!StringUtils.hasText(raw)) {
            return null;
        }
        try {
            return UUID.fromString(raw.trim());
        } catch (IllegalArgumentException e) {
            return null;
        }
    }
}
