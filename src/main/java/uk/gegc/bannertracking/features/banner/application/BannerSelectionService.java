package uk.gegc.bannertracking.features.banner.application;

import uk.gegc.bannertracking.features.banner.api.dto.BannerSelectionDto;
import uk.gegc.bannertracking.features.banner.domain.model.RecipientContext;

import java.util.Optional;
import java.util.UUID;

public interface BannerSelectionService {

    /**
     * Selects the banner to show for a placement.
     *
     * @param campaignId restrict candidates to one campaign, or {@code null} for all active banners
     * @param context    what is known about the recipient
     * @return the preferred eligible banner, empty when none qualifies
     */
    Optional<BannerSelectionDto> selectBanner(UUID campaignId, RecipientContext context);
}
