package uk.gegc.bannertracking.features.tracking.api.dto;

import io.swagger.v3.oas.annotations.media.Schema;
import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;

import java.util.UUID;

@Schema(description = "Payload for issuing a per-recipient tracking link")
public record CreateTrackingLinkRequest(
        @Schema(description = "Mailbox the banner is sent from", example = "sales@example.com", maxLength = 255)
        @NotBlank(message = "Sender email is required")
        @Email(message = "Sender email must be a valid email address")
        @Size(max = 255, message = "Sender email must be at most 255 characters")
        String senderEmail,

        @Schema(description = "Recipient of the email", example = "jane@example.org", maxLength = 255)
        @NotBlank(message = "Recipient email is required")
        @Email(message = "Recipient email must be a valid email address")
        @Size(max = 255, message = "Recipient email must be at most 255 characters")
        String recipientEmail,

        @Schema(description = "Banner the link points at", example = "3f1c2b7e-8a4d-4c55-9a0e-6e2f1d7b9c10")
        @NotNull(message = "Banner id is required")
        UUID bannerId
) {
}
