package uk.gegc.bannertracking.features.banner.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.MediaType;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.bannertracking.features.banner.api.dto.BannerSelectionDto;
import uk.gegc.bannertracking.features.banner.application.BannerPreviewService;
import uk.gegc.bannertracking.features.banner.application.BannerSelectionService;
import uk.gegc.bannertracking.features.banner.domain.model.RecipientContext;

import java.util.UUID;

@RestController
@RequestMapping("/api/v1/banners")
@RequiredArgsConstructor
@Tag(name = "Banners", description = "Banner placement selection and tracked HTML preview")
public class BannerController {

    private final BannerSelectionService bannerSelectionService;
    private final BannerPreviewService bannerPreviewService;

    @Operation(
            summary = "Select a banner for a placement",
            description = "Returns the preferred eligible banner, ordered by priority then newest first. " +
                    "Recipient attributes narrow the choice through banner targeting."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Banner selected",
                    content = @Content(schema = @Schema(implementation = BannerSelectionDto.class))),
            @ApiResponse(responseCode = "204", description = "No banner is currently eligible"),
            @ApiResponse(responseCode = "400", description = "Invalid campaign id",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/selection")
    public ResponseEntity<BannerSelectionDto> selectBanner(
            @Parameter(description = "Restrict the choice to one campaign")
            @RequestParam(required = false) UUID campaignId,
            @Parameter(description = "Recipient department") @RequestParam(required = false) String department,
            @Parameter(description = "Recipient device, e.g. mobile") @RequestParam(required = false) String device,
            @Parameter(description = "Recipient region") @RequestParam(required = false) String geo,
            @Parameter(description = "Recipient audience segment") @RequestParam(required = false) String audience
    ) {
        RecipientContext context = new RecipientContext(department, device, geo, audience);
        return bannerSelectionService.selectBanner(campaignId, context)
                .map(ResponseEntity::ok)
                .orElseGet(() -> ResponseEntity.noContent().build());
    }

    @Operation(
            summary = "Preview tracked banner HTML",
            description = "Returns the banner's HTML with links and images routed through the click tracker, " +
                    "optionally with the view pixel appended."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Tracked HTML returned",
                    content = @Content(mediaType = MediaType.TEXT_HTML_VALUE)),
            @ApiResponse(responseCode = "404", description = "Banner not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @GetMapping("/{bannerId}/tracked-html")
    public ResponseEntity<String> trackedHtml(
            @Parameter(description = "Banner identifier", required = true)
            @PathVariable UUID bannerId,
            @Parameter(description = "Recipient email embedded in the tracking URLs")
            @RequestParam(required = false) String email,
            @Parameter(description = "Append the 1x1 view pixel")
            @RequestParam(defaultValue = "false") boolean includePixel
    ) {
        String html = bannerPreviewService.renderTrackedHtml(bannerId, email, includePixel);
        return ResponseEntity.ok()
                .contentType(MediaType.TEXT_HTML)
                .body(html);
    }
}
