package uk.gegc.bannertracking.features.tracking.infra.html;

import java.util.Base64;

/**
 * The 43-byte transparent 1x1 GIF served by the view endpoint.
 */
public final class TrackingPixel {

    public static final String CONTENT_TYPE = "image/gif";

    private static final byte[] GIF = Base64.getDecoder()
            .decode("R0lGODlhAQABAIAAAAAAAP///yH5BAEAAAAALAAAAAABAAEAAAICRAEAOw==");

    private TrackingPixel() {
    }

    public static byte[] bytes() {
        return GIF.clone();
    }
}
