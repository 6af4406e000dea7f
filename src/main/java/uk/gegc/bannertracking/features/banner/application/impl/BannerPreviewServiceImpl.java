package uk.gegc.bannertracking.features.banner.application.impl;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.bannertracking.features.banner.application.BannerPreviewService;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.tracking.infra.html.TrackingHtmlRewriter;
import uk.gegc.bannertracking.shared.exception.ResourceNotFoundException;

import java.util.UUID;

@Service
@RequiredArgsConstructor
public class BannerPreviewServiceImpl implements BannerPreviewService {

    private final BannerRepository bannerRepository;
    private final TrackingHtmlRewriter trackingHtmlRewriter;

    @Override
    @Transactional(readOnly = true)
    public String renderTrackedHtml(UUID bannerId, String recipientEmail, boolean includeViewPixel) {
        Banner banner = bannerRepository.findById(bannerId)
                .orElseThrow(() -> new ResourceNotFoundException("Banner " + bannerId + " not found"));

        return trackingHtmlRewriter.rewrite(banner.getHtmlContent(), banner.getId(), recipientEmail, includeViewPixel);
    }
}
