package uk.gegc.bannertracking.features.banner.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.bannertracking.features.banner.api.dto.BannerSelectionDto;
import uk.gegc.bannertracking.features.banner.application.BannerEligibilityEvaluator;
import uk.gegc.bannertracking.features.banner.application.BannerSelectionService;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.model.RecipientContext;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.banner.infra.mapping.BannerMapper;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
@RequiredArgsConstructor
@Slf4j
public class BannerSelectionServiceImpl implements BannerSelectionService {

    private final BannerRepository bannerRepository;
    private final BannerEligibilityEvaluator eligibilityEvaluator;
    private final BannerMapper bannerMapper;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<BannerSelectionDto> selectBanner(UUID campaignId, RecipientContext context) {
        List<Banner> candidates = campaignId != null
                ? bannerRepository.findAllByActiveTrueAndCampaign_Id(campaignId)
                : bannerRepository.findAllByActiveTrue();

        Instant now = Instant.now(clock);
        Optional<Banner> selected = eligibilityEvaluator.select(candidates, now, context);

        log.debug("Banner selection: campaign={}, candidates={}, selected={}",
                campaignId, candidates.size(), selected.map(Banner::getId).orElse(null));

        return selected.map(bannerMapper::toSelectionDto);
    }
}
