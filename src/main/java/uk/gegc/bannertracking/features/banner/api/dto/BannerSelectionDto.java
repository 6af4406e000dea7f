package uk.gegc.bannertracking.features.banner.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(description = "Banner chosen for a placement")
public record BannerSelectionDto(
        @Schema(description = "Banner identifier", example = "3f1c2b7e-8a4d-4c55-9a0e-6e2f1d7b9c10")
        UUID id,

        @Schema(description = "Banner name")
        String name,

        @Schema(description = "Owning campaign, if any")
        UUID campaignId,

        @Schema(description = "Raw banner HTML, before tracking is applied")
        String htmlContent,

        @Schema(description = "Banner image URL")
        String imageUrl,

        @Schema(description = "Destination the click tracker redirects to")
        String clickUrl,

        @Schema(description = "Placement priority, lower is preferred", example = "1")
        int priority,

        @Schema(description = "Clicks counted so far", example = "42")
        int currentClicks,

        @Schema(description = "Click cap, null when uncapped", example = "1000")
        Integer maxClicks
) {
}
