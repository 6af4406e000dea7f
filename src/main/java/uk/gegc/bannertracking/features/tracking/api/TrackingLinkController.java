package uk.gegc.bannertracking.features.tracking.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ProblemDetail;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.bannertracking.features.tracking.api.dto.CreateTrackingLinkRequest;
import uk.gegc.bannertracking.features.tracking.api.dto.TrackingLinkDto;
import uk.gegc.bannertracking.features.tracking.application.TrackingLinkService;

@RestController
@RequestMapping("/api/v1/tracking-links")
@RequiredArgsConstructor
@Tag(name = "Tracking Links", description = "Per-recipient tracking links for outgoing email")
public class TrackingLinkController {

    private final TrackingLinkService trackingLinkService;

    @Operation(
            summary = "Issue a tracking link",
            description = "Returns the unexpired tracking link for the sender, recipient and banner, or creates a new one."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "201", description = "Tracking link created",
                    content = @Content(schema = @Schema(implementation = TrackingLinkDto.class))),
            @ApiResponse(responseCode = "200", description = "Existing tracking link returned",
                    content = @Content(schema = @Schema(implementation = TrackingLinkDto.class))),
            @ApiResponse(responseCode = "400", description = "Validation error",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class))),
            @ApiResponse(responseCode = "404", description = "Banner not found",
                    content = @Content(schema = @Schema(implementation = ProblemDetail.class)))
    })
    @PostMapping
    public ResponseEntity<TrackingLinkDto> createTrackingLink(@Valid @RequestBody CreateTrackingLinkRequest request) {
        TrackingLinkDto link = trackingLinkService.issueTrackingLink(request);
        return ResponseEntity.status(link.reused() ? HttpStatus.OK : HttpStatus.CREATED).body(link);
    }
}
