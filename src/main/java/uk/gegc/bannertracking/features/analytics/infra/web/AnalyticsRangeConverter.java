package uk.gegc.bannertracking.features.analytics.infra.web;

import org.springframework.core.convert.converter.Converter;
import org.springframework.stereotype.Component;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;

/**
 * Lets request parameters use the short codes ({@code 24h}, {@code 7d}, ...).
 */
@Component
public class AnalyticsRangeConverter implements Converter<String, AnalyticsRange> {

    @Override
    public AnalyticsRange convert(String source) {
        return AnalyticsRange.fromCode(source);
    }
}
