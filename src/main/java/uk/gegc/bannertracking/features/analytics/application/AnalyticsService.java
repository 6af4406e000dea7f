package uk.gegc.bannertracking.features.analytics.application;

import uk.gegc.bannertracking.features.analytics.api.dto.AnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.BannerAnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.api.dto.CampaignAnalyticsSummaryDto;
import uk.gegc.bannertracking.features.analytics.domain.model.AnalyticsRange;

import java.util.UUID;

/**
 * Read side of banner analytics. Windows end at the current time.
 */
public interface AnalyticsService {

    AnalyticsSummaryDto getSummary(AnalyticsRange range);

    BannerAnalyticsSummaryDto getBannerSummary(UUID bannerId, AnalyticsRange range);

    CampaignAnalyticsSummaryDto getCampaignSummary(UUID campaignId, AnalyticsRange range);
}
