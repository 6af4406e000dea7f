package uk.gegc.bannertracking.features.tracking.application;

public record ViewRequest(
        String bannerId,
        String email,
        String trackingId,
        String userAgent,
        String referrer,
        String ipAddress
) {
}
