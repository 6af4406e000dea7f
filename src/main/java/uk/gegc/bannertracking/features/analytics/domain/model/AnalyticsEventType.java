package uk.gegc.bannertracking.features.analytics.domain.model;

public enum AnalyticsEventType {
    VIEW,
    CLICK
}
