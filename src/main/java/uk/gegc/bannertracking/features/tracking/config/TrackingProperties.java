package uk.gegc.bannertracking.features.tracking.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

@Data
@Validated
@Component
@ConfigurationProperties(prefix = "app.tracking")
public class TrackingProperties {

    /**
     * Public origin the tracking endpoints are reachable at, used when building click and view URLs.
     */
    @NotBlank(message = "Tracking public base URL must be configured")
    private String publicBaseUrl = "http://localhost:8080";

    /**
     * Where a click is sent when the banner cannot be resolved or has no destination.
     */
    @NotBlank(message = "Tracking fallback redirect URL must be configured")
    private String fallbackRedirectUrl = "/";

    /**
     * Upper bound on how long a tracking request waits for the store.
     */
    @NotNull
    private Duration storeTimeout = Duration.ofSeconds(2);

    /**
     * Lifetime of a per-recipient tracking session.
     */
    @NotNull
    private Duration sessionTtl = Duration.ofDays(90);
}
