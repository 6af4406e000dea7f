package uk.gegc.bannertracking.features.analytics.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.util.UUID;

@Schema(description = "Banner ranked by lifetime clicks")
public record TopBannerDto(
        @Schema(description = "Banner identifier")
        UUID bannerId,

        @Schema(description = "Banner name")
        String name,

        @Schema(description = "Lifetime clicks counted against the banner", example = "128")
        long clicks
) {
}
