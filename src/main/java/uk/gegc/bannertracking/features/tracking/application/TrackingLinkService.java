package uk.gegc.bannertracking.features.tracking.application;

import uk.gegc.bannertracking.features.tracking.api.dto.CreateTrackingLinkRequest;
import uk.gegc.bannertracking.features.tracking.api.dto.TrackingLinkDto;

public interface TrackingLinkService {

    /**
     * Returns the unexpired tracking link for the sender, recipient and banner, creating one
     * when none exists.
     *
     * @throws uk.gegc.bannertracking.shared.exception.ResourceNotFoundException if the banner does not exist
     */
    TrackingLinkDto issueTrackingLink(CreateTrackingLinkRequest request);
}
