package uk.gegc.bannertracking.features.tracking.application;

/**
 * How a click request ended. Every outcome still produces a redirect.
 */
public enum ClickOutcome {

    /**
     * Event recorded and the banner's click counter moved
     */
    COUNTED,

    /**
     * Event recorded, counter left alone (not eligible, or the cap was reached concurrently)
     */
    NOT_COUNTED,

    /**
     * Banner resolved but recording did not finish within the store timeout or failed
     */
    RECORDING_INCOMPLETE,

    /**
     * Missing or malformed banner id / tracking id
     */
    INVALID_REQUEST,

    /**
     * Unknown banner, or unknown or expired tracking id
     */
    NOT_FOUND,

    /**
     * Banner lookup timed out or failed
     */
    STORE_UNAVAILABLE;

    public boolean isFallback() {
        return this == INVALID_REQUEST || this == NOT_FOUND || this == STORE_UNAVAILABLE;
    }
}
