package uk.gegc.bannertracking.features.tracking.application;

import uk.gegc.bannertracking.features.banner.domain.model.BannerEligibility;

public interface TrackingMetricsService {

    void recordClick(ClickOutcome outcome, BannerEligibility eligibility);

    void recordView(boolean recorded);

    void recordStoreTimeout(String operation);

    void recordStoreRejected(String operation);
}
