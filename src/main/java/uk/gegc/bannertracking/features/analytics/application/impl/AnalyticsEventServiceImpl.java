package uk.gegc.bannertracking.features.analytics.application.impl;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;
import uk.gegc.bannertracking.features.analytics.application.AnalyticsEventService;
import uk.gegc.bannertracking.features.analytics.application.RecordEventCommand;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsEvent;
import uk.gegc.bannertracking.features.analytics.domain.repository.AnalyticsEventRepository;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;

@Service
@RequiredArgsConstructor
@Slf4j
public class AnalyticsEventServiceImpl implements AnalyticsEventService {

    static final int MAX_USER_AGENT_LENGTH = 256;
    static final int MAX_REFERRER_LENGTH = 512;
    static final int MAX_IP_LENGTH = 45;
    static final int MAX_EMAIL_LENGTH = 255;

    private final AnalyticsEventRepository analyticsEventRepository;
    private final Clock clock;

    @Override
    public boolean recordEvent(RecordEventCommand command) {
        try {
            AnalyticsEvent event = AnalyticsEvent.builder()
                    .eventType(command.eventType())
                    .bannerId(command.bannerId())
                    .campaignId(command.campaignId())
                    .emailRecipient(normalizeEmail(command.emailRecipient()))
                    .occurredAt(Instant.now(clock))
                    .userAgent(truncate(command.userAgent(), MAX_USER_AGENT_LENGTH))
                    .referrer(truncate(command.referrer(), MAX_REFERRER_LENGTH))
                    .ipAddress(truncate(command.ipAddress(), MAX_IP_LENGTH))
                    .metadata(command.metadata() != null ? new LinkedHashMap<>(command.metadata()) : new LinkedHashMap<>())
                    .build();

            analyticsEventRepository.save(event);

            log.debug("Recorded {} event for banner: {}", command.eventType(), command.bannerId());
            return true;
        } catch (Exception e) {
            log.error("Failed to record {} event for banner: {}", command.eventType(), command.bannerId(), e);
            return false;
        }
    }

    private static String normalizeEmail(String email) {
        if (!StringUtils.hasText(email)) {
            return null;
        }
        return truncate(email.trim().toLowerCase(Locale.ROOT), MAX_EMAIL_LENGTH);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return null;
        }
        return value.length() <= maxLength ? value : value.substring(0, maxLength);
    }
}
