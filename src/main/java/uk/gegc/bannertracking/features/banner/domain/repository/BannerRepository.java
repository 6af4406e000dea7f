package uk.gegc.bannertracking.features.banner.domain.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface BannerRepository extends JpaRepository<Banner, UUID> {

    @Query("SELECT b FROM Banner b LEFT JOIN FETCH b.campaign WHERE b.id = :id")
    Optional<Banner> findWithCampaignById(@Param("id") UUID id);

    List<Banner> findAllByActiveTrue();

    List<Banner> findAllByActiveTrueAndCampaign_Id(UUID campaignId);

    /**
     * Banners with at least one click, highest lifetime click count first.
     */
    @Query("SELECT b FROM Banner b WHERE b.currentClicks > 0 ORDER BY b.currentClicks DESC, b.createdAt DESC")
    List<Banner> findTopByLifetimeClicks(Pageable pageable);

    /**
     * Adds one click in a single conditional statement so concurrent clicks neither
     * lose updates nor push the counter past {@code maxClicks}.
     *
     * @return 1 when the counter moved, 0 when the banner is missing or already at its cap
     */
    @Transactional
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Banner b SET b.currentClicks = b.currentClicks + 1, b.updatedAt = :now " +
           "WHERE b.id = :id AND (b.maxClicks IS NULL OR b.currentClicks < b.maxClicks)")
    int incrementClicksIfBelowCap(@Param("id") UUID bannerId, @Param("now") Instant now);
}
