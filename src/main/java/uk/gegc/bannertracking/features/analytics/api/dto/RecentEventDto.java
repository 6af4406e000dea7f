package uk.gegc.bannertracking.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEventType;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Recorded banner interaction")
public record RecentEventDto(
        @Schema(description = "Event identifier")
        UUID id,

        @Schema(description = "Interaction type", example = "CLICK")
        AnalyticsEventType eventType,

        @Schema(description = "Banner identifier")
        UUID bannerId,

        @Schema(description = "Banner name, when the banner still exists")
        String bannerName,

        @Schema(description = "Campaign identifier")
        UUID campaignId,

        @Schema(description = "Recipient address, when known")
        String emailRecipient,

        @Schema(description = "When the interaction happened")
        Instant occurredAt
) {
}
