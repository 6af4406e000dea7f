package uk.gegc.bannertracking.features.tracking.application.impl;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.bannertracking.features.analytics.application.AnalyticsEventService;
import uk.gegc.bannertracking.features.analytics.application.RecordEventCommand;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;
import uk.gegc.bannertracking.features.banner.application.BannerEligibilityEvaluator;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.model.BannerEligibility;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.tracking.application.ClickOutcome;
import uk.gegc.bannertracking.features.tracking.application.ClickRequest;
import uk.gegc.bannertracking.features.tracking.application.ClickResolution;
import uk.gegc.bannertracking.features.tracking.application.ClickTrackingService;
import uk.gegc.bannertracking.features.tracking.application.TrackingMetricsService;
import uk.gegc.bannertracking.features.tracking.config.TrackingProperties;
import uk.gegc.bannertracking.features.tracking.domain.model.TrackingSession;
import uk.gegc.bannertracking.features.tracking.domain.repository.TrackingSessionRepository;
import uk.gegc.bannertracking.shared.util.TrustedProxyUtil;

import java.net.URI;
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
import java.util.function.Supplier;

/**
 * Click resolution runs in two store steps on the tracking executor: banner lookup, then
 * event recording plus the capped counter update. Both share one deadline derived from
 * {@link TrackingProperties#getStoreTimeout()}; the request thread stops waiting when it
 * passes, while the store work itself runs to completion in the background.
 */
@Service
@Slf4j
public class ClickTrackingServiceImpl implements ClickTrackingService {

    static final String METADATA_ELIGIBILITY = "eligibility";
    static final String METADATA_TRACKING_ID = "tid";

    private final BannerRepository bannerRepository;
    private final TrackingSessionRepository trackingSessionRepository;
    private final BannerEligibilityEvaluator eligibilityEvaluator;
    private final AnalyticsEventService analyticsEventService;
    private final TrackingMetricsService trackingMetricsService;
    private final TrackingProperties trackingProperties;
    private final Executor trackingTaskExecutor;
    private final Clock clock;

    public ClickTrackingServiceImpl(BannerRepository bannerRepository,
                                    TrackingSessionRepository trackingSessionRepository,
                                    BannerEligibilityEvaluator eligibilityEvaluator,
                                    AnalyticsEventService analyticsEventService,
                                    TrackingMetricsService trackingMetricsService,
                                    TrackingProperties trackingProperties,
                                    @Qualifier("trackingTaskExecutor") Executor trackingTaskExecutor,
                                    Clock clock) {
        this.bannerRepository = bannerRepository;
        this.trackingSessionRepository = trackingSessionRepository;
        this.eligibilityEvaluator = eligibilityEvaluator;
        this.analyticsEventService = analyticsEventService;
        this.trackingMetricsService = trackingMetricsService;
        this.trackingProperties = trackingProperties;
        this.trackingTaskExecutor = trackingTaskExecutor;
        this.clock = clock;
    }

    @Override
    public ClickResolution resolveClick(ClickRequest request) {
        ClickResolution resolution;
        try {
            resolution = doResolve(request);
        } catch (RuntimeException e) {
            log.error("Unexpected failure resolving click for banner: {}", request.bannerId(), e);
            resolution = fallback(ClickOutcome.STORE_UNAVAILABLE);
        }
        trackingMetricsService.recordClick(resolution.outcome(), resolution.eligibility());
        return resolution;
    }

    private ClickResolution doResolve(ClickRequest request) {
        String trackingId = StringUtils.hasText(request.trackingId()) ? request.trackingId().trim() : null;
        UUID bannerId = null;

        if (trackingId == null) {
            bannerId = parseBannerId(request.bannerId());
            if (bannerId == null) {
                log.warn("Click request without a valid banner id: '{}'", request.bannerId());
                return fallback(ClickOutcome.INVALID_REQUEST);
            }
        }

        long deadline = System.nanoTime() + trackingProperties.getStoreTimeout().toNanos();

        Optional<ResolvedClick> resolved;
        UUID lookupBannerId = bannerId;
        try {
            resolved = awaitStore(
                    () -> trackingId != null ? lookupBySession(trackingId) : lookupByBanner(lookupBannerId),
                    deadline);
        } catch (TimeoutException e) {
            log.warn("Banner lookup timed out after {} for banner: {}, tid: {}",
                    trackingProperties.getStoreTimeout(), bannerId, trackingId);
            trackingMetricsService.recordStoreTimeout("click-lookup");
            return fallback(ClickOutcome.STORE_UNAVAILABLE);
        } catch (RejectedExecutionException e) {
            log.warn("Tracking executor saturated, skipping lookup for banner: {}, tid: {}", bannerId, trackingId);
            trackingMetricsService.recordStoreRejected("click-lookup");
            return fallback(ClickOutcome.STORE_UNAVAILABLE);
        } catch (ExecutionException e) {
            log.error("Banner lookup failed for banner: {}, tid: {}", bannerId, trackingId, e.getCause());
            return fallback(ClickOutcome.STORE_UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return fallback(ClickOutcome.STORE_UNAVAILABLE);
        }

        if (resolved.isEmpty()) {
            log.info("Click for unknown banner: {}, tid: {}", bannerId, trackingId);
            return fallback(ClickOutcome.NOT_FOUND);
        }

        ResolvedClick click = resolved.get();
        Banner banner = click.banner();
        BannerEligibility eligibility = eligibilityEvaluator.evaluate(banner, Instant.now(clock));
        String recipient = click.session() != null ? click.session().getRecipientEmail() : request.email();
        String redirectUrl = destinationOf(banner);

        ClickOutcome outcome;
        try {
            boolean counted = awaitStore(
                    () -> recordAndCount(banner, eligibility, recipient, trackingId, request),
                    deadline);
            outcome = counted ? ClickOutcome.COUNTED : ClickOutcome.NOT_COUNTED;
        } catch (TimeoutException e) {
            log.warn("Recording click for banner {} did not finish within {}, redirecting anyway",
                    banner.getId(), trackingProperties.getStoreTimeout());
            trackingMetricsService.recordStoreTimeout("click-record");
            outcome = ClickOutcome.RECORDING_INCOMPLETE;
        } catch (RejectedExecutionException e) {
            log.warn("Tracking executor saturated, click for banner {} not recorded", banner.getId());
            trackingMetricsService.recordStoreRejected("click-record");
            outcome = ClickOutcome.RECORDING_INCOMPLETE;
        } catch (ExecutionException e) {
            log.error("Failed to record click for banner: {}", banner.getId(), e.getCause());
            outcome = ClickOutcome.RECORDING_INCOMPLETE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            outcome = ClickOutcome.RECORDING_INCOMPLETE;
        }

        log.debug("Click resolved: banner={}, eligibility={}, outcome={}, ip={}",
                banner.getId(), eligibility, outcome, TrustedProxyUtil.maskIpAddress(request.ipAddress()));

        return new ClickResolution(redirectUrl, outcome, banner.getId(), eligibility);
    }

    private Optional<ResolvedClick> lookupByBanner(UUID bannerId) {
        return bannerRepository.findWithCampaignById(bannerId)
                .map(banner -> new ResolvedClick(banner, null));
    }

    private Optional<ResolvedClick> lookupBySession(String trackingId) {
        Optional<TrackingSession> session = trackingSessionRepository.findActiveByTrackingId(trackingId, Instant.now(clock));
        if (session.isEmpty()) {
            return Optional.empty();
        }
        return bannerRepository.findWithCampaignById(session.get().getBannerId())
                .map(banner -> new ResolvedClick(banner, session.get()));
    }

    /**
     * Stores the click event, then counts it.
     *
     * @return whether the banner's click counter moved
     */
    private boolean recordAndCount(Banner banner, BannerEligibility eligibility, String recipient,
                                   String trackingId, ClickRequest request) {
        Map<String, String> metadata = new LinkedHashMap<>();
        metadata.put(METADATA_ELIGIBILITY, eligibility.name());
        if (trackingId != null) {
            metadata.put(METADATA_TRACKING_ID, trackingId);
        }

        analyticsEventService.recordEvent(new RecordEventCommand(
                AnalyticsEventType.CLICK,
                banner.getId(),
                banner.getCampaignId(),
                recipient,
                request.userAgent(),
                request.referrer(),
                request.ipAddress(),
                metadata
        ));

        Instant now = Instant.now(clock);
        if (trackingId != null && trackingSessionRepository.recordClick(trackingId, now) == 0) {
            log.debug("Tracking session {} expired before its click was counted", trackingId);
        }

        if (!eligibility.isEligible()) {
            return false;
        }
        boolean counted = bannerRepository.incrementClicksIfBelowCap(banner.getId(), now) > 0;
        if (!counted) {
            log.debug("Banner {} reached its click cap concurrently, click not counted", banner.getId());
        }
        return counted;
    }

    /**
     * @throws RejectedExecutionException when the tracking executor has no room for the task
     */
    private <T> T awaitStore(Supplier<T> task, long deadlineNanos)
            throws TimeoutException, ExecutionException, InterruptedException {
        long remaining = deadlineNanos - System.nanoTime();
        if (remaining <= 0) {
            throw new TimeoutException("Store deadline already passed");
        }
        return CompletableFuture.supplyAsync(task, trackingTaskExecutor)
                .get(remaining, TimeUnit.NANOSECONDS);
    }

    private String destinationOf(Banner banner) {
        String clickUrl = banner.getClickUrl();
        if (!StringUtils.hasText(clickUrl)) {
            return trackingProperties.getFallbackRedirectUrl();
        }
        if (!isRedirectable(clickUrl.trim())) {
            log.warn("Banner {} has an unusable click URL, using fallback redirect", banner.getId());
            return trackingProperties.getFallbackRedirectUrl();
        }
        return clickUrl.trim();
    }

    private static boolean isRedirectable(String url) {
        try {
            URI uri = URI.create(url);
            String scheme = uri.getScheme();
            return scheme == null || "http".equalsIgnoreCase(scheme) || "https".equalsIgnoreCase(scheme);
        } catch (IllegalArgumentException e) {
            return false;
        }
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

    private ClickResolution fallback(ClickOutcome outcome) {
        return ClickResolution.fallback(trackingProperties.getFallbackRedirectUrl(), outcome);
    }

    private record ResolvedClick(Banner banner, TrackingSession session) {
    }
}
