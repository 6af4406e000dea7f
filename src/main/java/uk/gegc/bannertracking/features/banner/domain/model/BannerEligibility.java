package uk.gegc.bannertracking.features.banner.domain.model;

/**
 * Verdict of the eligibility check for a banner at a point in time.
 */
public enum BannerEligibility {

    ELIGIBLE,

    /**
     * The banner's active flag is off
     */
    INACTIVE,

    /**
     * Evaluated before the start date or after the end date
     */
    OUTSIDE_WINDOW,

    /**
     * A click cap is configured and has been reached
     */
    CAP_REACHED,

    /**
     * Targeting facets are configured and none matches the recipient
     */
    NOT_TARGETED;

    public boolean isEligible() {
        return this == ELIGIBLE;
    }
}
