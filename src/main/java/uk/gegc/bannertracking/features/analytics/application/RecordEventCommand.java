package uk.gegc.bannertracking.features.analytics.application;

import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;

import java.util.Map;
import java.util.UUID;

/**
 * Request-side details of a tracked interaction.
 */
public record RecordEventCommand(
        AnalyticsEventType eventType,
        UUID bannerId,
        UUID campaignId,
        String emailRecipient,
        String userAgent,
        String referrer,
        String ipAddress,
        Map<String, String> metadata
) {
}
