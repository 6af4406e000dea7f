package uk.gegc.bannertracking.features.banner.application;

import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.model.BannerEligibility;
import uk.gegc.bannertracking.features.banner.domain.model.RecipientContext;

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a banner may be served or counted at a given instant. Holds no state
 * and never touches the store.
 */
@Component
public class BannerEligibilityEvaluator {

    /**
     * Placement preference: lowest priority value first, then the most recently created.
     */
    public static final Comparator<Banner> PLACEMENT_ORDER = Comparator
            .comparingInt(Banner::getPriority)
            .thenComparing(Banner::getCreatedAt, Comparator.nullsLast(Comparator.reverseOrder()));

    public BannerEligibility evaluate(Banner banner, Instant now) {
        return evaluate(banner, now, RecipientContext.anonymous());
    }

    /**
     * Checks are applied in a fixed order so the verdict names the first rule that failed:
     * active flag, validity window, click cap, targeting.
     */
    public BannerEligibility evaluate(Banner banner, Instant now, RecipientContext context) {
        if (!banner.isActive()) {
            return BannerEligibility.INACTIVE;
        }
        if (!isWithinWindow(banner, now)) {
            return BannerEligibility.OUTSIDE_WINDOW;
        }
        if (isCapReached(banner)) {
            return BannerEligibility.CAP_REACHED;
        }
        if (!isTargeted(banner, context != null ? context : RecipientContext.anonymous())) {
            return BannerEligibility.NOT_TARGETED;
        }
        return BannerEligibility.ELIGIBLE;
    }

    /**
     * Picks the preferred eligible banner from the candidates, if any.
     */
    public Optional<Banner> select(Collection<Banner> candidates, Instant now, RecipientContext context) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }
        return candidates.stream()
                .filter(banner -> evaluate(banner, now, context).isEligible())
                .min(PLACEMENT_ORDER);
    }

    private boolean isWithinWindow(Banner banner, Instant now) {
        Instant start = banner.getStartDate();
        Instant end = banner.getEndDate();
        if (start != null && now.isBefore(start)) {
            return false;
        }
        return end == null || !now.isAfter(end);
    }

    private boolean isCapReached(Banner banner) {
        return banner.hasClickCap() && banner.getCurrentClicks() >= banner.getMaxClicks();
    }

    private boolean isTargeted(Banner banner, RecipientContext context) {
        List<FacetCheck> checks = List.of(
                new FacetCheck(banner.getTargetDepartments(), context.department()),
                new FacetCheck(banner.getDeviceTargeting(), context.device()),
                new FacetCheck(banner.getGeoTargeting(), context.geo()),
                new FacetCheck(banner.getTargetAudience(), context.audience())
        );

        List<FacetCheck> applicable = checks.stream()
                .filter(FacetCheck::isApplicable)
                .toList();

        // Nothing to compare against: the banner targets everyone or the recipient is unknown
        if (applicable.isEmpty()) {
            return true;
        }
        return applicable.stream().anyMatch(FacetCheck::matches);
    }

    private record FacetCheck(Set<String> allowed, String value) {

        boolean isApplicable() {
            return allowed != null && !allowed.isEmpty() && StringUtils.hasText(value);
        }

        boolean matches() {
            String normalized = value.trim().toLowerCase(Locale.ROOT);
            return allowed.stream()
                    .filter(StringUtils::hasText)
                    .anyMatch(option -> option.trim().toLowerCase(Locale.ROOT).equals(normalized));
        }
    }
}
