package uk.gegc.bannertracking.features.analytics.application;

/**
 * Append-only writer for banner interactions.
 */
public interface AnalyticsEventService {

    /**
     * Stores the event stamped with the current time. Failures are logged, never thrown,
     * so tracking responses do not depend on analytics.
     *
     * @return {@code true} if the event was stored
     */
    boolean recordEvent(RecordEventCommand command);
}
