package uk.gegc.bannertracking.features.tracking.infra.html;

import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.UriComponentsBuilder;
import uk.gegc.bannertracking.features.tracking.config.TrackingProperties;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.UUID;

/**
 * Builds the absolute URLs that tracked HTML points at.
 */
@Component
@RequiredArgsConstructor
public class TrackingUrlBuilder {

    public static final String CLICK_PATH = "/track/click";
    public static final String VIEW_PATH = "/track/view";

    private final TrackingProperties trackingProperties;

    public String clickUrl(UUID bannerId, String recipientEmail) {
        return bannerUrl(CLICK_PATH, bannerId, recipientEmail);
    }

    public String viewUrl(UUID bannerId, String recipientEmail) {
        return bannerUrl(VIEW_PATH, bannerId, recipientEmail);
    }

    public String sessionClickUrl(String trackingId) {
        return base()
                .path(CLICK_PATH)
                .queryParam("tid", encode(trackingId))
                .build(true)
                .toUriString();
    }

    private String bannerUrl(String path, UUID bannerId, String recipientEmail) {
        UriComponentsBuilder builder = base()
                .path(path)
                .queryParam("banner_id", bannerId);
        if (StringUtils.hasText(recipientEmail)) {
            // '+' and '@' must survive the round trip through servlet query decoding
            builder.queryParam("email", encode(recipientEmail.trim()));
        }
        return builder.build(true).toUriString();
    }

    private UriComponentsBuilder base() {
        String baseUrl = trackingProperties.getPublicBaseUrl();
        if (!StringUtils.hasText(baseUrl)) {
            return UriComponentsBuilder.newInstance();
        }
        String trimmed = baseUrl.trim();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        return UriComponentsBuilder.fromUriString(trimmed);
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
