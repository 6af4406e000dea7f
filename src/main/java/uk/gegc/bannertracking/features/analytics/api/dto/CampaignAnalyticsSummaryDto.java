package uk.gegc.bannertracking.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;

import java.util.UUID;

@Schema(description = "Totals for one campaign over a trailing window")
public record CampaignAnalyticsSummaryDto(
        @Schema(description = "Campaign identifier")
        UUID campaignId,

        @Schema(description = "Campaign name")
        String name,

        @Schema(description = "Window the totals cover", example = "30d")
        AnalyticsRange range,

        @Schema(description = "Click events in the window")
        long clicks,

        @Schema(description = "View events in the window")
        long views,

        @Schema(description = "Clicks per hundred views, two decimals")
        double clickThroughRate,

        @Schema(description = "Active banners in the campaign")
        int activeBanners
) {
}
