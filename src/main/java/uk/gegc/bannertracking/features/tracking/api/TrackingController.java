package uk.gegc.bannertracking.features.tracking.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.headers.Header;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import uk.gegc.bannertracking.features.tracking.application.ClickRequest;
import uk.gegc.bannertracking.features.tracking.application.ClickResolution;
import uk.gegc.bannertracking.features.tracking.application.ClickTrackingService;
import uk.gegc.bannertracking.features.tracking.application.ViewRequest;
import uk.gegc.bannertracking.features.tracking.application.ViewTrackingService;
import uk.gegc.bannertracking.features.tracking.config.TrackingProperties;
import uk.gegc.bannertracking.features.tracking.infra.html.TrackingPixel;
import uk.gegc.bannertracking.shared.util.TrustedProxyUtil;

import java.net.URI;

/**
 * Public endpoints embedded in outgoing email. Neither ever answers with an error: clicks
 * always redirect and views always get the pixel.
 */
@Slf4j
@RestController
@RequestMapping("/track")
@RequiredArgsConstructor
@Tag(name = "Tracking", description = "Click redirector and view pixel used by tracked banners")
public class TrackingController {

    private final ClickTrackingService clickTrackingService;
    private final ViewTrackingService viewTrackingService;
    private final TrackingProperties trackingProperties;
    private final TrustedProxyUtil trustedProxyUtil;

    @GetMapping("/click")
    @Operation(
            summary = "Resolve a tracked banner click",
            description = "Records the click and redirects to the banner destination. Unknown banners, " +
                    "invalid parameters and store failures redirect to the configured fallback URL."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "302", description = "Redirect to the banner destination or fallback",
                    headers = @Header(name = HttpHeaders.LOCATION, description = "Redirect target"))
    })
    public ResponseEntity<Void> click(
            @Parameter(description = "Banner identifier") @RequestParam(name = "banner_id", required = false) String bannerId,
            @Parameter(description = "Recipient email") @RequestParam(name = "email", required = false) String email,
            @Parameter(description = "Tracking session id") @RequestParam(name = "tid", required = false) String trackingId,
            HttpServletRequest httpRequest) {

        String location;
        try {
            String userAgent = httpRequest.getHeader(HttpHeaders.USER_AGENT);
            String ipAddress = trustedProxyUtil.getClientIp(httpRequest);
            String referrer = httpRequest.getHeader(HttpHeaders.REFERER);

            log.info("Banner click: banner={}, tid={}, IP: {}, User-Agent: {}",
                    bannerId, trackingId, TrustedProxyUtil.maskIpAddress(ipAddress), truncateUserAgent(userAgent));

            ClickResolution resolution = clickTrackingService.resolveClick(
                    new ClickRequest(bannerId, email, trackingId, userAgent, referrer, ipAddress));
            location = resolution.redirectUrl();
        } catch (Exception e) {
            log.error("Click tracking failed for banner: {}", bannerId, e);
            location = trackingProperties.getFallbackRedirectUrl();
        }

        return ResponseEntity.status(HttpStatus.FOUND)
                .location(toUri(location))
                .build();
    }

    @GetMapping("/view")
    @Operation(
            summary = "Tracking pixel",
            description = "Records a banner view and returns a transparent 1x1 GIF. Always succeeds."
    )
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Transparent GIF",
                    content = @Content(mediaType = TrackingPixel.CONTENT_TYPE))
    })
    public ResponseEntity<byte[]> view(
            @Parameter(description = "Banner identifier") @RequestParam(name = "banner_id", required = false) String bannerId,
            @Parameter(description = "Recipient email") @RequestParam(name = "email", required = false) String email,
            @Parameter(description = "Tracking session id") @RequestParam(name = "tid", required = false) String trackingId,
            HttpServletRequest httpRequest) {

        try {
            String userAgent = httpRequest.getHeader(HttpHeaders.USER_AGENT);
            String ipAddress = trustedProxyUtil.getClientIp(httpRequest);
            String referrer = httpRequest.getHeader(HttpHeaders.REFERER);

            viewTrackingService.recordView(new ViewRequest(bannerId, email, trackingId, userAgent, referrer, ipAddress));
        } catch (Exception e) {
            log.error("View tracking failed for banner: {}", bannerId, e);
        }

        return ResponseEntity.ok()
                .contentType(MediaType.IMAGE_GIF)
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .body(TrackingPixel.bytes());
    }

    private URI toUri(String location) {
        try {
            return URI.create(location);
        } catch (IllegalArgumentException e) {
            log.warn("Redirect target is not a valid URI, using fallback: {}", location);
            return URI.create(trackingProperties.getFallbackRedirectUrl());
        }
    }

    /**
     * Truncates user agent string for logging privacy.
     */
    private String truncateUserAgent(String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return "unknown";
        }

        if (userAgent.length() > 50) {
            return userAgent.substring(0, 47) + "...";
        }

        return userAgent;
    }
}
