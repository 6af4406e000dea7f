package uk.gegc.bannertracking.features.tracking.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.bannertracking.features.banner.domain.repository.BannerRepository;
import uk.gegc.bannertracking.features.tracking.api.dto.CreateTrackingLinkRequest;
import uk.gegc.bannertracking.features.tracking.api.dto.TrackingLinkDto;
import uk.gegc.bannertracking.features.tracking.application.TrackingLinkService;
import uk.gegc.bannertracking.features.tracking.config.TrackingProperties;
import uk.gegc.bannertracking.features.tracking.domain.model.TrackingSession;
import uk.gegc.bannertracking.features.tracking.domain.repository.TrackingSessionRepository;
import uk.gegc.bannertracking.features.tracking.infra.html.TrackingUrlBuilder;
import uk.gegc.bannertracking.shared.exception.ResourceNotFoundException;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Instant;
import java.util.HexFormat;
import java.util.Locale;
import java.util.Optional;

@Service
@RequiredArgsConstructor
@Slf4j
public class TrackingLinkServiceImpl implements TrackingLinkService {

    private static final int TRACKING_ID_BYTES = 16;
    private static final int MAX_GENERATION_ATTEMPTS = 5;

    private final TrackingSessionRepository trackingSessionRepository;
    private final BannerRepository bannerRepository;
    private final TrackingUrlBuilder trackingUrlBuilder;
    private final TrackingProperties trackingProperties;
    private final Clock clock;

    private final SecureRandom secureRandom = new SecureRandom();

    @Override
    @Transactional
    public TrackingLinkDto issueTrackingLink(CreateTrackingLinkRequest request) {
        if (!bannerRepository.existsById(request.bannerId())) {
            throw new ResourceNotFoundException("Banner " + request.bannerId() + " not found");
        }

        String sender = normalize(request.senderEmail());
        String recipient = normalize(request.recipientEmail());
        Instant now = Instant.now(clock);

        Optional<TrackingSession> existing = trackingSessionRepository
                .findFirstBySenderEmailAndRecipientEmailAndBannerIdAndExpiresAtAfterOrderByCreatedAtDesc(
                        sender, recipient, request.bannerId(), now);
        if (existing.isPresent()) {
            log.debug("Reusing tracking session {} for banner {}", existing.get().getId(), request.bannerId());
            return toDto(existing.get(), true);
        }

        TrackingSession session = TrackingSession.builder()
                .trackingId(generateTrackingId())
                .senderEmail(sender)
                .recipientEmail(recipient)
                .bannerId(request.bannerId())
                .createdAt(now)
                .expiresAt(now.plus(trackingProperties.getSessionTtl()))
                .clickCount(0)
                .build();

        TrackingSession saved = trackingSessionRepository.save(session);
        log.info("Created tracking session {} for banner {}", saved.getId(), request.bannerId());
        return toDto(saved, false);
    }

    private String generateTrackingId() {
        for (int attempt = 0; attempt < MAX_GENERATION_ATTEMPTS; attempt++) {
            byte[] bytes = new byte[TRACKING_ID_BYTES];
            secureRandom.nextBytes(bytes);
            String candidate = HexFormat.of().formatHex(bytes);
            if (!trackingSessionRepository.existsByTrackingId(candidate)) {
                return candidate;
            }
        }
        throw new IllegalStateException("Could not generate a unique tracking id");
    }

    private TrackingLinkDto toDto(TrackingSession session, boolean reused) {
        return new TrackingLinkDto(
                session.getTrackingId(),
                trackingUrlBuilder.sessionClickUrl(session.getTrackingId()),
                session.getSenderEmail(),
                session.getRecipientEmail(),
                session.getBannerId(),
                session.getExpiresAt(),
                reused
        );
    }

    private static String normalize(String email) {
        return email.trim().toLowerCase(Locale.ROOT);
    }
}
