package uk.gegc.bannertracking.features.tracking.application.impl;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import uk.gegc.bannertracking.features.banner.domain.model.BannerEligibility;
import uk.gegc.bannertracking.features.tracking.application.ClickOutcome;
import uk.gegc.bannertracking.features.tracking.application.TrackingMetricsService;

/**
 * Micrometer counters for the tracking endpoints.
 */
@Slf4j
@Service
public class TrackingMetricsServiceImpl implements TrackingMetricsService {

    private final MeterRegistry meterRegistry;

    private final Counter viewsRecordedCounter;
    private final Counter viewsIgnoredCounter;

    public TrackingMetricsServiceImpl(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;

        this.viewsRecordedCounter = Counter.builder("tracking.views.recorded")
                .description("Number of banner views stored")
                .register(meterRegistry);
        this.viewsIgnoredCounter = Counter.builder("tracking.views.ignored")
                .description("Number of pixel requests that did not produce a view event")
                .register(meterRegistry);
    }

    @Override
    public void recordClick(ClickOutcome outcome, BannerEligibility eligibility) {
        Counter.builder("tracking.clicks.resolved")
                .description("Number of click requests by outcome")
                .tag("outcome", outcome.name().toLowerCase())
                .tag("eligibility", eligibility != null ? eligibility.name().toLowerCase() : "none")
                .register(meterRegistry)
                .increment();

        if (outcome.isFallback()) {
            Counter.builder("tracking.clicks.fallback")
                    .description("Number of clicks sent to the fallback redirect")
                    .register(meterRegistry)
                    .increment();
        }
        log.debug("Click metrics recorded: outcome={}, eligibility={}", outcome, eligibility);
    }

    @Override
    public void recordView(boolean recorded) {
        if (recorded) {
            viewsRecordedCounter.increment();
        } else {
            viewsIgnoredCounter.increment();
        }
    }

    @Override
    public void recordStoreTimeout(String operation) {
        Counter.builder("tracking.store.timeouts")
                .description("Number of store calls abandoned after the tracking store timeout")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }

    @Override
    public void recordStoreRejected(String operation) {
        Counter.builder("tracking.store.rejections")
                .description("Number of store calls refused because the tracking executor was saturated")
                .tag("operation", operation)
                .register(meterRegistry)
                .increment();
    }
}
