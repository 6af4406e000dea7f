package uk.gegc.bannertracking.features.tracking.application;

/**
 * Raw click parameters as they arrive on the tracking URL, plus request metadata.
 */
public record ClickRequest(
        String bannerId,
        String email,
        String trackingId,
        String userAgent,
        String referrer,
        String ipAddress
) {
}
