package uk.gegc.bannertracking.features.tracking.application;

public interface ViewTrackingService {

    /**
     * Records a view of the banner. Never throws.
     *
     * @return {@code true} if a view event was stored
     */
    boolean recordView(ViewRequest request);
}
