package uk.gegc.bannertracking.features.tracking.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.bannertracking.features.tracking.domain.model.TrackingSession;

import java.time.Instant;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface TrackingSessionRepository extends JpaRepository<TrackingSession, UUID> {

    @Query("SELECT s FROM TrackingSession s WHERE s.trackingId = :trackingId AND s.expiresAt > :now")
    Optional<TrackingSession> findActiveByTrackingId(@Param("trackingId") String trackingId,
                                                     @Param("now") Instant now);

    Optional<TrackingSession> findFirstBySenderEmailAndRecipientEmailAndBannerIdAndExpiresAtAfterOrderByCreatedAtDesc(
            String senderEmail, String recipientEmail, UUID bannerId, Instant now);

    boolean existsByTrackingId(String trackingId);

    /**
     * Counts a click against an unexpired session in one statement.
     *
     * @return 1 when the session was updated, 0 when it is missing or expired
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE TrackingSession s SET s.clickCount = s.clickCount + 1, s.lastClickedAt = :now " +
           "WHERE s.trackingId = :trackingId AND s.expiresAt > :now")
    int recordClick(@Param("trackingId") String trackingId, @Param("now") Instant now);
}
