package uk.gegc.bannertracking.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;

import java.util.UUID;

@Schema(description = "Totals for one banner over a trailing window")
public record BannerAnalyticsSummaryDto(
        @Schema(description = "Banner identifier")
        UUID bannerId,

        @Schema(description = "Banner name")
        String name,

        @Schema(description = "Window the totals cover", example = "30d")
        AnalyticsRange range,

        @Schema(description = "Click events in the window")
        long clicks,

        @Schema(description = "View events in the window")
        long views,

        @Schema(description = "Clicks per hundred views, two decimals")
        double clickThroughRate,

        @Schema(description = "Lifetime clicks counted against the cap")
        int lifetimeClicks,

        @Schema(description = "Click cap, null when uncapped")
        Integer maxClicks,

        @Schema(description = "Distinct recipients with an event in the window")
        long uniqueRecipients
) {
}
