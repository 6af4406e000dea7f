package uk.gegc.bannertracking.features.tracking.application;

public interface ClickTrackingService {

    /**
     * Resolves a tracked click to its destination, recording the click and counting it
     * against the banner's cap when the banner is eligible.
     * <p>
     * Never throws: anything that prevents resolving the banner yields the configured
     * fallback redirect.
     */
    ClickResolution resolveClick(ClickRequest request);
}
