package uk.gegc.bannertracking.features.tracking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;

import java.time.Instant;
import java.util.UUID;

@Schema(description = "Tracking link issued for one sender, recipient and banner")
public record TrackingLinkDto(
        @Schema(description = "Opaque tracking id", example = "9f86d081884c7d659a2feaa0c55ad015")
        String trackingId,

        @Schema(description = "Click URL carrying the tracking id", example = "https://track.example.com/track/click?tid=9f86d081884c7d659a2feaa0c55ad015")
        String trackingUrl,

        @Schema(description = "Sender mailbox")
        String senderEmail,

        @Schema(description = "Recipient address")
        String recipientEmail,

        @Schema(description = "Banner identifier")
        UUID bannerId,

        @Schema(description = "When the link stops resolving")
        Instant expiresAt,

        @Schema(description = "Whether an existing unexpired link was returned")
        boolean reused
) {
}
