package uk.gegc.bannertracking.features.analytics.domain.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class AnalyticsRangeTest {

    @ParameterizedTest
    @CsvSource({
            "24h, LAST_24_HOURS",
            "7d, LAST_7_DAYS",
            "30D, LAST_30_DAYS",
            "' 90d ', LAST_90_DAYS",
            "last_30_days, LAST_30_DAYS"
    })
    void fromCode_acceptsCodesAndNames(String code, AnalyticsRange expected) {
        assertThat(AnalyticsRange.fromCode(code)).isEqualTo(expected);
    }

    @Test
    @DisplayName("missing range falls back to seven days")
    void fromCode_blank_defaults() {
        assertThat(AnalyticsRange.fromCode(null)).isEqualTo(AnalyticsRange.LAST_7_DAYS);
        assertThat(AnalyticsRange.fromCode("")).isEqualTo(AnalyticsRange.LAST_7_DAYS);
    }

    @Test
    void fromCode_unknown_rejected() {
        assertThatThrownBy(() -> AnalyticsRange.fromCode("1y"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("1y");
    }

    @Test
    void startingAt_subtractsWindow() {
        Instant end = Instant.parse("2024-06-15T12:00:00Z");

        assertThat(AnalyticsRange.LAST_24_HOURS.startingAt(end)).isEqualTo(end.minus(Duration.ofHours(24)));
        assertThat(AnalyticsRange.LAST_90_DAYS.startingAt(end)).isEqualTo(Instant.parse("2024-03-17T12:00:00Z"));
    }
}
