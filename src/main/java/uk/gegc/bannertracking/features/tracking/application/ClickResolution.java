package uk.gegc.bannertracking.features.tracking.application;

import uk.gegc.bannertracking.features.banner.domain.model.BannerEligibility;

import java.util.UUID;

/**
 * @param redirectUrl where the browser is sent, never {@code null}
 * @param eligibility verdict for the resolved banner, {@code null} when no banner was resolved
 */
public record ClickResolution(
        String redirectUrl,
        ClickOutcome outcome,
        UUID bannerId,
        BannerEligibility eligibility
) {

    public static ClickResolution fallback(String redirectUrl, ClickOutcome outcome) {
        return new ClickResolution(redirectUrl, outcome, null, null);
    }
}
