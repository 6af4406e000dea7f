package uk.gegc.bannertracking.features.analytics.application.impl;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.springframework.dao.DataIntegrityViolationException;
import uk.gegc.bannertracking.BaseUnitTest;
import uk.gegc.bannertracking.features.analytics.application.RecordEventCommand;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEvent;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;
import uk.gegc.bannertracking.features.analytics.domain.repository.AnalyticsEventRepository;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AnalyticsEventServiceImplTest extends BaseUnitTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    @Mock
    private AnalyticsEventRepository analyticsEventRepository;

    private AnalyticsEventServiceImpl analyticsEventService;

    @BeforeEach
    void setUp() {
        analyticsEventService = new AnalyticsEventServiceImpl(analyticsEventRepository, Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("recordEvent: stores a normalized, truncated event stamped with the current time")
    void recordEvent_truncatesAndNormalizes() {
        UUID bannerId = UUID.randomUUID();
        UUID campaignId = UUID.randomUUID();
        String longUserAgent = "A".repeat(300);
        String longReferrer = "https://mail.example.com/" + "r".repeat(600);

        boolean recorded = analyticsEventService.recordEvent(new RecordEventCommand(
                AnalyticsEventType.CLICK,
                bannerId,
                campaignId,
                "  Jane.Doe@Example.ORG ",
                longUserAgent,
                longReferrer,
                "2001:0db8:85a3:0000:0000:8a2e:0370:7334",
                Map.of("eligibility", "ELIGIBLE")
        ));

        assertThat(recorded).isTrue();
        ArgumentCaptor<AnalyticsEvent> captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(analyticsEventRepository).save(captor.capture());
        AnalyticsEvent saved = captor.getValue();
        assertThat(saved.getEventType()).isEqualTo(AnalyticsEventType.CLICK);
        assertThat(saved.getBannerId()).isEqualTo(bannerId);
        assertThat(saved.getCampaignId()).isEqualTo(campaignId);
        assertThat(saved.getEmailRecipient()).isEqualTo("jane.doe@example.org");
        assertThat(saved.getOccurredAt()).isEqualTo(NOW);
        assertThat(saved.getUserAgent()).hasSize(256);
        assertThat(saved.getReferrer()).hasSize(512);
        assertThat(saved.getIpAddress()).isEqualTo("2001:0db8:85a3:0000:0000:8a2e:0370:7334");
        assertThat(saved.getMetadata()).containsEntry("eligibility", "ELIGIBLE");
    }

    @Test
    @DisplayName("recordEvent: blank recipient and missing metadata are stored as absent")
    void recordEvent_blankRecipient() {
        analyticsEventService.recordEvent(new RecordEventCommand(
                AnalyticsEventType.VIEW, UUID.randomUUID(), null, "   ", null, null, null, null));

        ArgumentCaptor<AnalyticsEvent> captor = ArgumentCaptor.forClass(AnalyticsEvent.class);
        verify(analyticsEventRepository).save(captor.capture());
        assertThat(captor.getValue().getEmailRecipient()).isNull();
        assertThat(captor.getValue().getMetadata()).isEmpty();
    }

    @Test
    @DisplayName("recordEvent: store failure is logged and reported, never thrown")
    void recordEvent_storeFailure_returnsFalse() {
        when(analyticsEventRepository.save(any(AnalyticsEvent.class)))
                .thenThrow(new DataIntegrityViolationException("constraint"));

        boolean recorded = analyticsEventService.recordEvent(new RecordEventCommand(
                AnalyticsEventType.VIEW, UUID.randomUUID(), null, null, null, null, null, Map.of()));

        assertThat(recorded).isFalse();
    }
}
