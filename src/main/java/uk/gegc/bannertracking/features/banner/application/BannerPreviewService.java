package uk.gegc.bannertracking.features.banner.application;

import java.util.UUID;

public interface BannerPreviewService {

    /**
     * Returns the banner's HTML with its links and images routed through the click tracker.
     *
     * @throws uk.gegc.bannertracking.shared.exception.ResourceNotFoundException if the banner does not exist
     */
    String renderTrackedHtml(UUID bannerId, String recipientEmail, boolean includeViewPixel);
}
