package uk.gegc.bannertracking.features.banner.infra.mapping;

import org.springframework.stereotype.Component;
import uk.gegc.bannertracking.features.banner.api.dto.BannerSelectionDto;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;

@Component
public class BannerMapper {

    public BannerSelectionDto toSelectionDto(Banner banner) {
        return new BannerSelectionDto(
                banner.getId(),
                banner.getName(),
                banner.getCampaignId(),
                banner.getHtmlContent(),
                banner.getImageUrl(),
                banner.getClickUrl(),
                banner.getPriority(),
                banner.getCurrentClicks(),
                banner.getMaxClicks()
        );
    }
}
