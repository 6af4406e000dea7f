package uk.gegc.bannertracking.features.banner.application;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import uk.gegc.bannertracking.BannerFixtures;
import uk.gegc.bannertracking.features.banner.domain.model.Banner;
import uk.gegc.bannertracking.features.banner.domain.model.BannerEligibility;
import uk.gegc.bannertracking.features.banner.domain.model.RecipientContext;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class BannerEligibilityEvaluatorTest {

    private static final Instant NOW = Instant.parse("2024-06-15T12:00:00Z");

    private BannerEligibilityEvaluator evaluator;
    private Banner banner;

    @BeforeEach
    void setUp() {
        evaluator = new BannerEligibilityEvaluator();
        banner = BannerFixtures.activeBanner();
    }

    @Test
    @DisplayName("evaluate: active banner without limits is eligible")
    void evaluate_plainBanner_eligible() {
        assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.ELIGIBLE);
    }

    @Test
    @DisplayName("evaluate: inactive banner is reported inactive before any other rule")
    void evaluate_inactive_winsOverOtherFailures() {
        banner.setActive(false);
        banner.setStartDate(NOW.plus(Duration.ofDays(1)));
        banner.setMaxClicks(1);
        banner.setCurrentClicks(5);

        assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.INACTIVE);
    }

    @Nested
    @DisplayName("Validity window")
    class ValidityWindow {

        @Test
        @DisplayName("start date in the future gives OUTSIDE_WINDOW")
        void futureStart_outsideWindow() {
            banner.setStartDate(NOW.plus(Duration.ofDays(1)));

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.OUTSIDE_WINDOW);
        }

        @Test
        @DisplayName("end date in the past gives OUTSIDE_WINDOW")
        void pastEnd_outsideWindow() {
            banner.setEndDate(NOW.minusSeconds(1));

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.OUTSIDE_WINDOW);
        }

        @Test
        @DisplayName("bounds are inclusive")
        void bounds_inclusive() {
            banner.setStartDate(NOW);
            banner.setEndDate(NOW);

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.ELIGIBLE);
        }

        @Test
        @DisplayName("window is checked before the cap")
        void window_beforeCap() {
            banner.setEndDate(NOW.minus(Duration.ofDays(1)));
            banner.setMaxClicks(1);
            banner.setCurrentClicks(1);

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.OUTSIDE_WINDOW);
        }
    }

    @Nested
    @DisplayName("Click cap")
    class ClickCap {

        @Test
        @DisplayName("counter at the cap gives CAP_REACHED")
        void atCap_capReached() {
            banner.setMaxClicks(2);
            banner.setCurrentClicks(2);

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.CAP_REACHED);
        }

        @Test
        @DisplayName("counter below the cap is eligible")
        void belowCap_eligible() {
            banner.setMaxClicks(2);
            banner.setCurrentClicks(1);

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.ELIGIBLE);
        }

        @Test
        @DisplayName("no cap means unlimited")
        void noCap_eligible() {
            banner.setCurrentClicks(1_000_000);

            assertThat(evaluator.evaluate(banner, NOW)).isEqualTo(BannerEligibility.ELIGIBLE);
        }
    }

    @Nested
    @DisplayName("Targeting")
    class Targeting {

        @Test
        @DisplayName("recipient outside every supplied facet gives NOT_TARGETED")
        void noMatchingFacet_notTargeted() {
            banner.setTargetDepartments(Set.of("Sales"));
            banner.setGeoTargeting(Set.of("UK"));

            RecipientContext context = new RecipientContext("Engineering", null, "US", null);

            assertThat(evaluator.evaluate(banner, NOW, context)).isEqualTo(BannerEligibility.NOT_TARGETED);
        }

        @Test
        @DisplayName("any matching facet is enough, case-insensitively")
        void oneMatchingFacet_eligible() {
            banner.setTargetDepartments(Set.of("Sales"));
            banner.setGeoTargeting(Set.of("UK"));

            RecipientContext context = new RecipientContext("engineering", null, "uk", null);

            assertThat(evaluator.evaluate(banner, NOW, context)).isEqualTo(BannerEligibility.ELIGIBLE);
        }

        @Test
        @DisplayName("facets the recipient does not supply are skipped")
        void unsuppliedFacet_skipped() {
            banner.setDeviceTargeting(Set.of("mobile"));

            RecipientContext context = new RecipientContext("Sales", null, null, null);

            assertThat(evaluator.evaluate(banner, NOW, context)).isEqualTo(BannerEligibility.ELIGIBLE);
        }

        @Test
        @DisplayName("anonymous recipient matches a targeted banner")
        void anonymous_matchesEveryone() {
            banner.setTargetAudience(Set.of("partners"));

            assertThat(evaluator.evaluate(banner, NOW, RecipientContext.anonymous()))
                    .isEqualTo(BannerEligibility.ELIGIBLE);
        }

        @Test
        @DisplayName("banner without targeting matches everyone")
        void noTargeting_matchesEveryone() {
            RecipientContext context = new RecipientContext("Legal", "desktop", "DE", "staff");

            assertThat(evaluator.evaluate(banner, NOW, context)).isEqualTo(BannerEligibility.ELIGIBLE);
        }
    }

    @Nested
    @DisplayName("Placement selection")
    class Selection {

        @Test
        @DisplayName("select: skips an ineligible banner with a better priority")
        void select_skipsIneligible() {
            Banner first = BannerFixtures.activeBanner();
            first.setPriority(1);
            first.setActive(false);
            Banner second = BannerFixtures.activeBanner();
            second.setPriority(2);

            assertThat(evaluator.select(List.of(first, second), NOW, RecipientContext.anonymous()))
                    .contains(second);
        }

        @Test
        @DisplayName("select: lower priority value wins, then the newest banner")
        void select_ordersByPriorityThenNewest() {
            Banner older = BannerFixtures.activeBanner();
            older.setPriority(1);
            older.setCreatedAt(NOW.minus(Duration.ofDays(10)));
            Banner newer = BannerFixtures.activeBanner();
            newer.setPriority(1);
            newer.setCreatedAt(NOW.minus(Duration.ofDays(1)));
            Banner lowPriority = BannerFixtures.activeBanner();
            lowPriority.setPriority(5);
            lowPriority.setCreatedAt(NOW);

            assertThat(evaluator.select(List.of(lowPriority, older, newer), NOW, RecipientContext.anonymous()))
                    .contains(newer);
        }

        @Test
        @DisplayName("select: empty when nothing is eligible")
        void select_noneEligible() {
            Banner capped = BannerFixtures.activeBanner();
            capped.setMaxClicks(1);
            capped.setCurrentClicks(1);

            assertThat(evaluator.select(List.of(capped), NOW, RecipientContext.anonymous())).isEmpty();
            assertThat(evaluator.select(List.of(), NOW, RecipientContext.anonymous())).isEmpty();
        }
    }
}
