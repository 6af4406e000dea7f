package uk.gegc.bannertracking.features.analytics.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;

/**
 * Trailing window the dashboard aggregates over, ending at the time of the request.
 */
public enum AnalyticsRange {

    LAST_24_HOURS("24h", Duration.ofHours(24)),
    LAST_7_DAYS("7d", Duration.ofDays(7)),
    LAST_30_DAYS("30d", Duration.ofDays(30)),
    LAST_90_DAYS("90d", Duration.ofDays(90));

    public static final AnalyticsRange DEFAULT = LAST_7_DAYS;

    private final String code;
    private final Duration length;

    AnalyticsRange(String code, Duration length) {
        this.code = code;
        this.length = length;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public Instant startingAt(Instant end) {
        return end.minus(length);
    }

    @JsonCreator
    public static AnalyticsRange fromCode(String code) {
        if (code == null || code.isBlank()) {
            return DEFAULT;
        }
        String normalized = code.trim();
        return Arrays.stream(values())
                .filter(range -> range.code.equalsIgnoreCase(normalized) || range.name().equalsIgnoreCase(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unsupported analytics range: " + code));
    }
}
