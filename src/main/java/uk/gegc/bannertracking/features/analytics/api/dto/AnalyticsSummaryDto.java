package uk.gegc.bannertracking.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;

import java.time.Instant;
import java.util.List;

@Schema(description = "Dashboard totals for a trailing window")
public record AnalyticsSummaryDto(
        @Schema(description = "Window the totals cover", example = "7d")
        AnalyticsRange range,

        @Schema(description = "Window start")
        Instant from,

        @Schema(description = "Window end")
        Instant to,

        @Schema(description = "Click events in the window", example = "42")
        long totalClicks,

        @Schema(description = "View events in the window", example = "1200")
        long totalViews,

        @Schema(description = "Clicks per hundred views, two decimals", example = "3.5")
        double clickThroughRate,

        @Schema(description = "Banners with the most lifetime clicks")
        List<TopBannerDto> topBanners,

        @Schema(description = "Most recent events in the window, newest first")
        List<RecentEventDto> recentEvents
) {
}
