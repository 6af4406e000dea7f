package uk.gegc.bannertracking.shared.config;

import org.springdoc.core.models.GroupedOpenApi;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * API documentation groups: the public tracking redirector and the dashboard-facing API.
 */
@Configuration
public class OpenApiGroupConfig {

    @Bean
    public GroupedOpenApi trackingGroup() {
        return GroupedOpenApi.builder()
                .group("tracking")
                .displayName("Click & View Tracking")
                .pathsToMatch("/track/**")
                .build();
    }

    @Bean
    public GroupedOpenApi dashboardGroup() {
        return GroupedOpenApi.builder()
                .group("dashboard")
                .displayName("Banners, Tracking Links & Analytics")
                .pathsToMatch(
                    "/api/v1/banners/**",
                    "/api/v1/tracking-links/**",
                    "/api/v1/analytics/**"
                )
                .build();
    }
}
