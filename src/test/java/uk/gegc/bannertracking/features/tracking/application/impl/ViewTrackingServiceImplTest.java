package uk.gegc.bannertracking.features.tracking.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataAccessResourceFailureException;
import uk.gegc.bannertracking.BannerFixtures;
import uk.gegc.bannertracking.BaseUnitTest;
import uk.gegc.bannertracking.features.analytics.application.AnalyticsEventService;
import uk.gegc.bannertracking.features.analytics.application.RecordEventCommand;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.tracking.application.TrackingMetricsService;
import uk.gegc.bannertracking.features.tracking.application.ViewRequest;
import uk.gegc.bannertracking.features.tracking.config.TrackingProperties;
import uk.gegc.bannertracking.features.tracking.domain.model.TrackingSession;
import uk.gegc.bannertracking.features.tracking.domain.repository.TrackingSessionRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class ViewTrackingServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    @Mock
    private BannerRepository bannerRepository;

    @Mock
    private TrackingSessionRepository trackingSessionRepository;

    @Mock
    private AnalyticsEventService analyticsEventService;

    @Mock
    private TrackingMetricsService trackingMetricsService;

    private TrackingProperties properties;
    private ViewTrackingServiceImpl viewTrackingService;
    private Banner banner;

    @BeforeEach
    void setUp() {
        properties = new TrackingProperties();
        properties.setStoreTimeout(Duration.ofSeconds(2));

        viewTrackingService = new ViewTrackingServiceImpl(
                bannerRepository,
                trackingSessionRepository,
                analyticsEventService,
                trackingMetricsService,
                properties,
                Runnable::run,
                Clock.fixed(NOW, ZoneOffset.UTC)
        );
        banner = BannerFixtures.activeBanner();
    }

    @Test
    @DisplayName("known banner: view event recorded with request context")
    void knownBanner_recordsView() {
        when(bannerRepository.findWithCampaignById(banner.getId())).thenReturn(Optional.of(banner));
        when(analyticsEventService.recordEvent(any(RecordEventCommand.class))).thenReturn(true);

        boolean recorded = viewTrackingService.recordView(new ViewRequest(
                banner.getId().toString(), "Jane@Example.org", null, "Mozilla/5.0", null, "203.0.113.7"));

        assertThat(recorded).isTrue();
        ArgumentCaptor<RecordEventCommand> captor = ArgumentCaptor.forClass(RecordEventCommand.class);
        verify(analyticsEventService).recordEvent(captor.capture());
        assertThat(captor.getValue().eventType()).isEqualTo(AnalyticsEventType.VIEW);
        assertThat(captor.getValue().bannerId()).isEqualTo(banner.getId());
        assertThat(captor.getValue().emailRecipient()).isEqualTo("Jane@Example.org");
        assertThat(captor.getValue().userAgent()).isEqualTo("Mozilla/5.0");
        verify(trackingMetricsService).recordView(true);
    }

    @Test
    @DisplayName("inactive banner views are still recorded")
    void inactiveBanner_stillRecorded() {
        banner.setActive(false);
        when(bannerRepository.findWithCampaignById(banner.getId())).thenReturn(Optional.of(banner));
        when(analyticsEventService.recordEvent(any(RecordEventCommand.class))).thenReturn(true);

        assertThat(viewTrackingService.recordView(new ViewRequest(
                banner.getId().toString(), null, null, null, null, null))).isTrue();
    }

    @Test
    @DisplayName("unknown banner: nothing recorded")
    void unknownBanner_noEvent() {
        UUID missing = UUID.randomUUID();
        when(bannerRepository.findWithCampaignById(missing)).thenReturn(Optional.empty());

        boolean recorded = viewTrackingService.recordView(new ViewRequest(
                missing.toString(), null, null, null, null, null));

        assertThat(recorded).isFalse();
        verifyNoInteractions(analyticsEventService);
        verify(trackingMetricsService).recordView(false);
    }

    @Test
    @DisplayName("malformed banner id never reaches the store")
    void malformedBannerId_ignored() {
        boolean recorded = viewTrackingService.recordView(new ViewRequest(
                "12345", null, null, null, null, null));

        assertThat(recorded).isFalse();
        verifyNoInteractions(bannerRepository, trackingSessionRepository, analyticsEventService);
    }

    @Test
    @DisplayName("store failure is swallowed and reported as not recorded")
    void storeFailure_notRecorded() {
        when(bannerRepository.findWithCampaignById(banner.getId()))
                .thenThrow(new DataAccessResourceFailureException("database down"));

        boolean recorded = viewTrackingService.recordView(new ViewRequest(
                banner.getId().toString(), null, null, null, null, null));

        assertThat(recorded).isFalse();
        verify(trackingMetricsService).recordView(false);
    }

    @Test
    @DisplayName("saturated tracking executor: view dropped without touching the store")
    void saturatedExecutor_notRecorded() {
        ViewTrackingServiceImpl saturated = new ViewTrackingServiceImpl(
                bannerRepository,
                trackingSessionRepository,
                analyticsEventService,
                trackingMetricsService,
                properties,
                command -> {
                    throw new RejectedExecutionException("tracking executor saturated");
                },
                Clock.fixed(NOW, ZoneOffset.UTC)
        );

        boolean recorded = saturated.recordView(new ViewRequest(
                banner.getId().toString(), null, null, null, null, null));

        assertThat(recorded).isFalse();
        verify(trackingMetricsService).recordStoreRejected("view");
        verify(trackingMetricsService).recordView(false);
        verifyNoInteractions(bannerRepository, analyticsEventService);
    }

    @Test
    @DisplayName("tracking session supplies banner and recipient")
    void trackingSession_resolvesBannerAndRecipient() {
        TrackingSession session = TrackingSession.builder()
                .trackingId("abcdefabcdefabcdefabcdefabcdefab")
                .senderEmail("sales@example.com")
                .recipientEmail("bob@example.org")
                .bannerId(banner.getId())
                .createdAt(NOW.minus(Duration.ofDays(1)))
                .expiresAt(NOW.plus(Duration.ofDays(30)))
                .build();
        when(trackingSessionRepository.findActiveByTrackingId(session.getTrackingId(), NOW))
                .thenReturn(Optional.of(session));
        when(bannerRepository.findWithCampaignById(banner.getId())).thenReturn(Optional.of(banner));
        when(analyticsEventService.recordEvent(any(RecordEventCommand.class))).thenReturn(true);

        boolean recorded = viewTrackingService.recordView(new ViewRequest(
                null, null, session.getTrackingId(), null, null, null));

        assertThat(recorded).isTrue();
        ArgumentCaptor<RecordEventCommand> captor = ArgumentCaptor.forClass(RecordEventCommand.class);
        verify(analyticsEventService).recordEvent(captor.capture());
        assertThat(captor.getValue().emailRecipient()).isEqualTo("bob@example.org");
        assertThat(captor.getValue().metadata()).containsEntry("tid", session.getTrackingId());
    }

    @Test
    @DisplayName("expired tracking session without a banner id is ignored")
    void expiredSession_ignored() {
        when(trackingSessionRepository.findActiveByTrackingId("deadbeefdeadbeefdeadbeefdeadbeef", NOW))
                .thenReturn(Optional.empty());

        boolean recorded = viewTrackingService.recordView(new ViewRequest(
                null, null, "deadbeefdeadbeefdeadbeefdeadbeef", null, null, null));

        assertThat(recorded).isFalse();
        verifyNoInteractions(bannerRepository, analyticsEventService);
    }
}
