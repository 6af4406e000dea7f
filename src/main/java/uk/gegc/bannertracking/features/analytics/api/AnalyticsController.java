package uk.gegc.bannertracking.features.analytics.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.bannertracking.features.analytics.api.dto.AnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.BannerAnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.CampaignAnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.application.AnalyticsService;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/analytics")
@RequiredArgsConstructor
@Tag(name = "Analytics", description = "Banner click and view analytics for the dashboard")
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    @Operation(
            summary = "Dashboard summary",
            description = "Click and view totals, click-through rate, top banners by lifetime clicks and the " +
                    "most recent events for the selected window."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary returned",
                    content = @Content(schema = @Schema(implementation = AnalyticsSummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Unsupported range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/summary")
    public ResponseEntity<AnalyticsSummaryDto> getSummary(
            @Parameter(description = "Window: 24h, 7d, 30d or 90d", example = "7d")
            @RequestParam(defaultValue = "7d") AnalyticsRange range
    ) {
        return ResponseEntity.ok(analyticsService.getSummary(range));
    }

    @Operation(summary = "Banner summary", description = "Window totals and lifetime counters for one banner.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary returned",
                    content = @Content(schema = @Schema(implementation = BannerAnalyticsSummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid id or range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Banner not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/banners/{bannerId}")
    public ResponseEntity<BannerAnalyticsSummaryDto> getBannerSummary(
            @Parameter(description = "Banner identifier", required = true) @PathVariable UUID bannerId,
            @Parameter(description = "Window: 24h, 7d, 30d or 90d", example = "30d")
            @RequestParam(defaultValue = "7d") AnalyticsRange range
    ) {
        return ResponseEntity.ok(analyticsService.getBannerSummary(bannerId, range));
    }

    @Operation(summary = "Campaign summary", description = "Window totals for events tagged with the campaign.")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Summary returned",
                    content = @Content(schema = @Schema(implementation = CampaignAnalyticsSummaryDto.class))),
            @ApiResponse(responseCode = "400", description = "Invalid id or range",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Campaign not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/campaigns/{campaignId}")
    public ResponseEntity<CampaignAnalyticsSummaryDto> getCampaignSummary(
            @Parameter(description = "Campaign identifier", required = true) @PathVariable UUID campaignId,
            @Parameter(description = "Window: 24h, 7d, 30d or 90d", example = "30d")
            @RequestParam(defaultValue = "7d") AnalyticsRange range
    ) {
        return ResponseEntity.ok(analyticsService.getCampaignSummary(campaignId, range));
    }
}
